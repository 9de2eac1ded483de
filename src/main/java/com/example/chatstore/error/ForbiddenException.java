package com.example.chatstore.error;

/**
 * Raised at the tool boundary when a caller acts on a resource it does not own.
 * The core services never throw this; they trust their caller.
 */
public class ForbiddenException extends ChatStoreException {

    private final String resource;
    private final String id;
    private final String userId;

    public ForbiddenException(String resource, String id, String userId) {
        super("User " + userId + " may not access " + resource + " " + id);
        this.resource = resource;
        this.id = id;
        this.userId = userId;
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }
}
