package com.example.chatstore.error;

public class StoreUnavailableException extends ChatStoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
