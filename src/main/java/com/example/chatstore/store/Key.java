package com.example.chatstore.store;

import lombok.Value;

/**
 * Primary (or index) key of one record: the partition groups related records,
 * the sort key orders them inside the partition.
 */
@Value
public class Key {
    String partitionKey;
    String sortKey;

    public static Key of(String partitionKey, String sortKey) {
        return new Key(partitionKey, sortKey);
    }
}
