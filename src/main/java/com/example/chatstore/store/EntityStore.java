package com.example.chatstore.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Record-level access to the single logical table. Items are attribute maps that always carry
 * {@link KeySchema#PK} and {@link KeySchema#SK}; items in the secondary index also carry
 * {@link KeySchema#GSI1PK} and {@link KeySchema#GSI1SK}.
 *
 * <p>No operation spans more than one record. Callers sequence multi-record work themselves.
 * A {@code limit} of zero or less means no limit.
 */
public interface EntityStore {

    /**
     * Writes an item. With {@code uniqueOnCreate} an existing record under the same primary key
     * fails with {@link com.example.chatstore.error.AlreadyExistsException}; otherwise it is replaced.
     */
    void put(Map<String, Object> item, boolean uniqueOnCreate);

    Optional<Map<String, Object>> get(Key key);

    List<Map<String, Object>> queryByPrefix(String partitionKey, String sortKeyPrefix, SortOrder order, int limit);

    List<Map<String, Object>> queryIndex(String indexPartitionKey, String indexSortKeyPrefix, SortOrder order, int limit);

    /**
     * Applies the ops to an existing record and returns it as stored afterwards.
     * Empty when no record exists; nothing is created in that case.
     */
    Optional<Map<String, Object>> update(Key key, Map<String, FieldOp> fieldOps);

    /**
     * Like {@link #update} but creates the record when it is missing.
     */
    Map<String, Object> upsert(Key key, Map<String, FieldOp> fieldOps);

    /**
     * Removes the record. Deleting a missing key is not an error.
     */
    void delete(Key key);

    /**
     * Distinct partition keys starting with the prefix, in key order, beginning after
     * {@code startAfter} when it is not null.
     */
    List<String> listPartitions(String partitionKeyPrefix, String startAfter, int limit);
}
