package com.example.chatstore.error;

public class NotFoundException extends ChatStoreException {

    private final String resource;
    private final String id;

    public NotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
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
