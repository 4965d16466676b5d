package com.demochat.service.realtime;

import java.util.UUID;

public class MessageRenderException extends RuntimeException {

    private final UUID messageId;

    public MessageRenderException(UUID messageId, String message) {
        super(message);
        this.messageId = messageId;
    }

    public UUID getMessageId() {
        return messageId;
    }
}
