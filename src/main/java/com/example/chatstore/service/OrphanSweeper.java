package com.example.chatstore.service;

import com.example.chatstore.store.EntityStore;
import com.example.chatstore.store.ItemMapper;
import com.example.chatstore.store.KeySchema;
import com.example.chatstore.store.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finishes chat deletions that stopped after removing some children but before the chat record:
 * a chat partition without a {@code META} record is deleted once its newest record is older than
 * the grace period.
 */
@Service
public class OrphanSweeper {

    private static final Logger logger = LoggerFactory.getLogger(OrphanSweeper.class);

    private final EntityStore store;
    private final Clock clock;
    private final boolean enabled;
    private final Duration gracePeriod;
    private final int batchSize;

    private String cursor;

    public OrphanSweeper(EntityStore store,
                         Clock clock,
                         @Value("${app.store.sweep.enabled:true}") boolean enabled,
                         @Value("${app.store.sweep.grace-period-seconds:600}") long gracePeriodSeconds,
                         @Value("${app.store.sweep.batch-size:200}") int batchSize) {
        this.store = store;
        this.clock = clock;
        this.enabled = enabled;
        this.gracePeriod = Duration.ofSeconds(gracePeriodSeconds);
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${app.store.sweep.interval-ms:300000}", initialDelay = 60000L)
    public void run() {
        if (!enabled) return;
        try {
            sweep();
        } catch (Exception e) {
            // next run picks up where this one stopped
            logger.warn("Orphan sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Checks the next batch of chat partitions, wrapping around after the last one.
     *
     * @return number of records removed
     */
    public synchronized int sweep() {
        Instant cutoff = clock.instant().minus(gracePeriod);
        List<String> partitions = store.listPartitions(KeySchema.CHAT_PREFIX, cursor, batchSize);
        cursor = batchSize <= 0 || partitions.size() < batchSize ? null : partitions.get(partitions.size() - 1);

        int removed = 0;
        for (String partition : partitions) {
            List<Map<String, Object>> items = store.queryByPrefix(partition, "", SortOrder.ASC, 0);
            if (items.isEmpty() || hasChatRecord(items) || newest(items).isAfter(cutoff)) {
                continue;
            }
            for (Map<String, Object> item : items) {
                store.delete(ItemMapper.keyOf(item));
            }
            removed += items.size();
            logger.info("Removed {} orphaned record(s) from {}", items.size(), partition);
        }
        return removed;
    }

    private static boolean hasChatRecord(List<Map<String, Object>> items) {
        return items.stream().anyMatch(item -> KeySchema.META.equals(item.get(KeySchema.SK)));
    }

    private static Instant newest(List<Map<String, Object>> items) {
        return items.stream()
                .map(item -> item.get(ItemMapper.CREATED_AT))
                .filter(Objects::nonNull)
                .map(value -> KeySchema.parseTimestamp(value.toString()))
                .max(Instant::compareTo)
                .orElse(Instant.MIN);
    }
}
