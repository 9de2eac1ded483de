package com.example.chatstore.store;

public enum SortOrder {
    ASC,
    DESC
}
