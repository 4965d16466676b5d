package com.demochat.store;

public class MessageStoreException extends RuntimeException {

    public MessageStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
