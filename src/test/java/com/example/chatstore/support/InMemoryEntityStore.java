package com.example.chatstore.support;

import com.example.chatstore.error.AlreadyExistsException;
import com.example.chatstore.store.EntityStore;
import com.example.chatstore.store.FieldOp;
import com.example.chatstore.store.Key;
import com.example.chatstore.store.KeySchema;
import com.example.chatstore.store.SortOrder;

import java.util.*;
import java.util.stream.Collectors;

/**
 * {@link EntityStore} over sorted in-process maps. Items are copied on the way in and out so callers
 * cannot reach stored state through a returned map.
 */
public class InMemoryEntityStore implements EntityStore {

    private final TreeMap<String, TreeMap<String, Map<String, Object>>> partitions = new TreeMap<>();

    @Override
    public synchronized void put(Map<String, Object> item, boolean uniqueOnCreate) {
        String pk = (String) item.get(KeySchema.PK);
        String sk = (String) item.get(KeySchema.SK);
        if (pk == null || sk == null) {
            throw new IllegalArgumentException("Item must carry PK and SK");
        }
        TreeMap<String, Map<String, Object>> partition = partitions.computeIfAbsent(pk, k -> new TreeMap<>());
        if (uniqueOnCreate && partition.containsKey(sk)) {
            throw new AlreadyExistsException(pk, sk);
        }
        partition.put(sk, copy(item));
    }

    @Override
    public synchronized Optional<Map<String, Object>> get(Key key) {
        return Optional.ofNullable(find(key)).map(InMemoryEntityStore::copy);
    }

    @Override
    public synchronized List<Map<String, Object>> queryByPrefix(String partitionKey, String sortKeyPrefix, SortOrder order, int limit) {
        TreeMap<String, Map<String, Object>> partition = partitions.getOrDefault(partitionKey, new TreeMap<>());
        List<Map<String, Object>> matches = partition.entrySet().stream()
                .filter(e -> e.getKey().startsWith(sortKeyPrefix))
                .map(Map.Entry::getValue)
                .collect(Collectors.toList());
        return finish(matches, order, limit);
    }

    @Override
    public synchronized List<Map<String, Object>> queryIndex(String indexPartitionKey, String indexSortKeyPrefix, SortOrder order, int limit) {
        List<Map<String, Object>> matches = partitions.values().stream()
                .flatMap(p -> p.values().stream())
                .filter(item -> indexPartitionKey.equals(item.get(KeySchema.GSI1PK)))
                .filter(item -> item.get(KeySchema.GSI1SK) != null
                        && item.get(KeySchema.GSI1SK).toString().startsWith(indexSortKeyPrefix))
                .sorted(Comparator.comparing((Map<String, Object> item) -> item.get(KeySchema.GSI1SK).toString())
                        .thenComparing(item -> item.get(KeySchema.PK).toString()))
                .collect(Collectors.toList());
        return finish(matches, order, limit);
    }

    @Override
    public synchronized Optional<Map<String, Object>> update(Key key, Map<String, FieldOp> fieldOps) {
        Map<String, Object> existing = find(key);
        if (existing == null) {
            return Optional.empty();
        }
        apply(existing, fieldOps);
        return Optional.of(copy(existing));
    }

    @Override
    public synchronized Map<String, Object> upsert(Key key, Map<String, FieldOp> fieldOps) {
        Map<String, Object> existing = find(key);
        if (existing == null) {
            existing = new LinkedHashMap<>();
            existing.put(KeySchema.PK, key.getPartitionKey());
            existing.put(KeySchema.SK, key.getSortKey());
            partitions.computeIfAbsent(key.getPartitionKey(), k -> new TreeMap<>()).put(key.getSortKey(), existing);
        }
        apply(existing, fieldOps);
        return copy(existing);
    }

    @Override
    public synchronized void delete(Key key) {
        TreeMap<String, Map<String, Object>> partition = partitions.get(key.getPartitionKey());
        if (partition == null) {
            return;
        }
        partition.remove(key.getSortKey());
        if (partition.isEmpty()) {
            partitions.remove(key.getPartitionKey());
        }
    }

    @Override
    public synchronized List<String> listPartitions(String partitionKeyPrefix, String startAfter, int limit) {
        return partitions.keySet().stream()
                .filter(pk -> pk.startsWith(partitionKeyPrefix))
                .filter(pk -> startAfter == null || pk.compareTo(startAfter) > 0)
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .collect(Collectors.toList());
    }

    /**
     * Every record stored under the partition, in sort key order.
     */
    public synchronized List<Map<String, Object>> partition(String partitionKey) {
        return queryByPrefix(partitionKey, "", SortOrder.ASC, 0);
    }

    public synchronized int size() {
        return partitions.values().stream().mapToInt(Map::size).sum();
    }

    private Map<String, Object> find(Key key) {
        TreeMap<String, Map<String, Object>> partition = partitions.get(key.getPartitionKey());
        return partition == null ? null : partition.get(key.getSortKey());
    }

    private static void apply(Map<String, Object> item, Map<String, FieldOp> fieldOps) {
        for (Map.Entry<String, FieldOp> e : fieldOps.entrySet()) {
            if (KeySchema.PK.equals(e.getKey()) || KeySchema.SK.equals(e.getKey())) {
                throw new IllegalArgumentException("Key attribute cannot be updated: " + e.getKey());
            }
            if (e.getValue().isRemove()) {
                item.remove(e.getKey());
            } else {
                item.put(e.getKey(), copyValue(e.getValue().getValue()));
            }
        }
    }

    private static List<Map<String, Object>> finish(List<Map<String, Object>> matches, SortOrder order, int limit) {
        List<Map<String, Object>> ordered = new ArrayList<>(matches);
        if (order == SortOrder.DESC) {
            Collections.reverse(ordered);
        }
        return ordered.stream()
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .map(InMemoryEntityStore::copy)
                .collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> copy(Map<String, Object> item) {
        return (Map<String, Object>) copyValue(item);
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> out = new LinkedHashMap<>();
            ((Map<String, Object>) value).forEach((k, v) -> out.put(k, copyValue(v)));
            return out;
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object v : (List<Object>) value) {
                out.add(copyValue(v));
            }
            return out;
        }
        return value;
    }
}
