package com.example.chatstore.store;

import com.example.chatstore.error.AlreadyExistsException;
import com.example.chatstore.error.StoreUnavailableException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link EntityStore} over one MongoDB collection. The document {@code _id} is the compound
 * {@code {PK, SK}} so the primary key is unique without a separate constraint.
 */
@Component
public class MongoEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoEntityStore.class);

    static final String ID_FIELD = "_id";

    private final MongoTemplate mongo;
    private final String collection;

    @Autowired
    public MongoEntityStore(MongoTemplate mongo, @Value("${app.store.collection:items}") String collection) {
        this.mongo = mongo;
        this.collection = collection;
    }

    @Override
    public void put(Map<String, Object> item, boolean uniqueOnCreate) {
        Key key = ItemMapper.keyOf(item);
        requireKey(key);
        Document doc = new Document(item);
        doc.put(ID_FIELD, idOf(key));
        if (uniqueOnCreate) {
            try {
                mongo.insert(doc, collection);
            } catch (DuplicateKeyException e) {
                throw new AlreadyExistsException(key.getPartitionKey(), key.getSortKey());
            } catch (DataAccessException e) {
                throw unavailable("put", key, e);
            }
        } else {
            run("put", key, () -> mongo.save(doc, collection));
        }
        logger.debug("Put {} / {} (unique={})", key.getPartitionKey(), key.getSortKey(), uniqueOnCreate);
    }

    @Override
    public Optional<Map<String, Object>> get(Key key) {
        Document doc = run("get", key, () -> mongo.findOne(byId(key), Document.class, collection));
        return Optional.ofNullable(doc).map(MongoEntityStore::toItem);
    }

    @Override
    public List<Map<String, Object>> queryByPrefix(String partitionKey, String sortKeyPrefix, SortOrder order, int limit) {
        Query q = new Query(Criteria.where(KeySchema.PK).is(partitionKey)
                .and(KeySchema.SK).gte(sortKeyPrefix).lt(upperBound(sortKeyPrefix)));
        return find(q, KeySchema.SK, order, limit, Key.of(partitionKey, sortKeyPrefix));
    }

    @Override
    public List<Map<String, Object>> queryIndex(String indexPartitionKey, String indexSortKeyPrefix, SortOrder order, int limit) {
        Query q = new Query(Criteria.where(KeySchema.GSI1PK).is(indexPartitionKey)
                .and(KeySchema.GSI1SK).gte(indexSortKeyPrefix).lt(upperBound(indexSortKeyPrefix)));
        return find(q, KeySchema.GSI1SK, order, limit, Key.of(indexPartitionKey, indexSortKeyPrefix));
    }

    @Override
    public Optional<Map<String, Object>> update(Key key, Map<String, FieldOp> fieldOps) {
        if (fieldOps.isEmpty()) {
            return get(key);
        }
        Update update = toUpdate(fieldOps);
        Document doc = run("update", key, () -> mongo.findAndModify(byId(key), update,
                FindAndModifyOptions.options().returnNew(true), Document.class, collection));
        return Optional.ofNullable(doc).map(MongoEntityStore::toItem);
    }

    @Override
    public Map<String, Object> upsert(Key key, Map<String, FieldOp> fieldOps) {
        Update update = toUpdate(fieldOps)
                .setOnInsert(KeySchema.PK, key.getPartitionKey())
                .setOnInsert(KeySchema.SK, key.getSortKey());
        Document doc = run("upsert", key, () -> mongo.findAndModify(byId(key), update,
                FindAndModifyOptions.options().returnNew(true).upsert(true), Document.class, collection));
        return toItem(doc);
    }

    @Override
    public void delete(Key key) {
        run("delete", key, () -> mongo.remove(byId(key), collection));
        logger.debug("Deleted {} / {}", key.getPartitionKey(), key.getSortKey());
    }

    /**
     * Groups by partition key on the server so that only one batch of keys comes back, however many
     * partitions the collection holds.
     */
    @Override
    public List<String> listPartitions(String partitionKeyPrefix, String startAfter, int limit) {
        Criteria range = startAfter != null && startAfter.compareTo(partitionKeyPrefix) >= 0
                ? Criteria.where(KeySchema.PK).gt(startAfter)
                : Criteria.where(KeySchema.PK).gte(partitionKeyPrefix);
        List<AggregationOperation> ops = new ArrayList<>();
        ops.add(Aggregation.match(range.lt(upperBound(partitionKeyPrefix))));
        ops.add(Aggregation.group(KeySchema.PK));
        ops.add(Aggregation.sort(Sort.Direction.ASC, ID_FIELD));
        if (limit > 0) {
            ops.add(Aggregation.limit(limit));
        }
        Aggregation agg = Aggregation.newAggregation(ops);
        AggregationResults<Document> results = run("listPartitions", Key.of(partitionKeyPrefix, ""),
                () -> mongo.aggregate(agg, collection, Document.class));
        return results.getMappedResults().stream()
                .map(doc -> doc.getString(ID_FIELD))
                .collect(Collectors.toList());
    }

    private List<Map<String, Object>> find(Query q, String sortField, SortOrder order, int limit, Key context) {
        q.with(Sort.by(order == SortOrder.DESC ? Sort.Direction.DESC : Sort.Direction.ASC, sortField));
        if (limit > 0) q.limit(limit);
        List<Document> docs = run("query", context, () -> mongo.find(q, Document.class, collection));
        return docs.stream().map(MongoEntityStore::toItem).collect(Collectors.toList());
    }

    private Update toUpdate(Map<String, FieldOp> fieldOps) {
        Update update = new Update();
        for (Map.Entry<String, FieldOp> e : fieldOps.entrySet()) {
            String field = e.getKey();
            if (KeySchema.PK.equals(field) || KeySchema.SK.equals(field) || ID_FIELD.equals(field)) {
                throw new IllegalArgumentException("Key attribute cannot be updated: " + field);
            }
            if (e.getValue().isRemove()) {
                update.unset(field);
            } else {
                update.set(field, e.getValue().getValue());
            }
        }
        return update;
    }

    private <T> T run(String operation, Key key, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw unavailable(operation, key, e);
        }
    }

    private StoreUnavailableException unavailable(String operation, Key key, DataAccessException e) {
        logger.error("Store {} failed for {} / {}", operation, key.getPartitionKey(), key.getSortKey(), e);
        return new StoreUnavailableException("Store " + operation + " failed for " + key.getPartitionKey(), e);
    }

    private static Query byId(Key key) {
        return new Query(Criteria.where(ID_FIELD).is(idOf(key)));
    }

    static Document idOf(Key key) {
        return new Document(KeySchema.PK, key.getPartitionKey()).append(KeySchema.SK, key.getSortKey());
    }

    // keys never contain U+FFFF, so this bounds every key with the prefix
    private static String upperBound(String prefix) {
        return prefix + Character.MAX_VALUE;
    }

    private static void requireKey(Key key) {
        if (key.getPartitionKey() == null || key.getSortKey() == null) {
            throw new IllegalArgumentException("Item must carry " + KeySchema.PK + " and " + KeySchema.SK);
        }
    }

    private static Map<String, Object> toItem(Document doc) {
        Map<String, Object> item = new LinkedHashMap<>(doc);
        item.remove(ID_FIELD);
        return item;
    }
}
