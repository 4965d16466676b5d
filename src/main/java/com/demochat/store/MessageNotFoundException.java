package com.demochat.store;

import java.util.UUID;

public class MessageNotFoundException extends RuntimeException {

    private final UUID messageId;

    public MessageNotFoundException(UUID messageId) {
        super("Message " + messageId + " not found");
        this.messageId = messageId;
    }

    public UUID getMessageId() {
        return messageId;
    }
}
