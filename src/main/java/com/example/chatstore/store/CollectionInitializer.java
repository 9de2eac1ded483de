package com.example.chatstore.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.stereotype.Component;

/**
 * Creates the item collection's indexes on startup: the primary {@code PK/SK} range index and the
 * sparse {@code GSI1PK/GSI1SK} secondary index.
 */
@Component
@ConditionalOnProperty(name = "app.store.init-indexes", havingValue = "true", matchIfMissing = true)
public class CollectionInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(CollectionInitializer.class);

    static final String PRIMARY_INDEX = "pk_sk";
    static final String SECONDARY_INDEX = "gsi1";

    private final MongoTemplate mongo;
    private final String collection;

    public CollectionInitializer(MongoTemplate mongo, @Value("${app.store.collection:items}") String collection) {
        this.mongo = mongo;
        this.collection = collection;
    }

    @Override
    public void run(String... args) {
        if (!mongo.collectionExists(collection)) {
            logger.info("Creating collection \"{}\"", collection);
            mongo.createCollection(collection);
        }
        IndexOperations indexes = mongo.indexOps(collection);
        indexes.ensureIndex(new Index()
                .on(KeySchema.PK, Sort.Direction.ASC)
                .on(KeySchema.SK, Sort.Direction.ASC)
                .named(PRIMARY_INDEX));
        indexes.ensureIndex(new Index()
                .on(KeySchema.GSI1PK, Sort.Direction.ASC)
                .on(KeySchema.GSI1SK, Sort.Direction.ASC)
                .sparse()
                .named(SECONDARY_INDEX));
        logger.info("Indexes ready on \"{}\"", collection);
    }
}
