package com.demochat.model.dto;

import java.util.Objects;
import java.util.UUID;

/**
 * A decoded change notification.
 *
 * @param kind      what happened to the row
 * @param messageId id of the changed message
 * @param channelId chat channel the message belongs to, i.e. the topic
 */
public record ChangeEvent(
        ChangeKind kind,
        UUID messageId,
        UUID channelId
) {
    public ChangeEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(channelId, "channelId");
    }
}
