package com.example.chatstore.error;

public class ChatStoreException extends RuntimeException {

    public ChatStoreException(String message) {
        super(message);
    }

    public ChatStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
