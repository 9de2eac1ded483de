package com.example.chatstore.error;

public class AlreadyExistsException extends ChatStoreException {

    private final String resource;
    private final String id;

    public AlreadyExistsException(String resource, String id) {
        super(resource + " already exists: " + id);
        this.resource = resource;
        this.id = id;
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }
}
