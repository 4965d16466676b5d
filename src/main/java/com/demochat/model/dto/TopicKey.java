package com.demochat.model.dto;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a live topic. Change events only carry the channel id, so the
 * channel id alone is the routing key; the server id is kept for building
 * links in rendered messages.
 */
public record TopicKey(UUID channelId, UUID serverId) {
    public TopicKey {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(serverId, "serverId");
    }

    /**
     * Base path of the channel's message resources.
     */
    public String messagesPath() {
        return "/servers/" + serverId + "/channels/" + channelId + "/messages";
    }
}
