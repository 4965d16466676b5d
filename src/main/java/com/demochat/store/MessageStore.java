package com.demochat.store;

import com.demochat.model.dto.LiveMessage;

import java.util.UUID;

/**
 * Read access to chat messages for live rendering.
 * Allows swapping the JPA implementation for a stub in tests.
 */
public interface MessageStore {

    /**
     * @throws MessageNotFoundException when no message has this id
     * @throws MessageStoreException    when the store cannot be read
     */
    LiveMessage fetchMessage(UUID messageId);
}
