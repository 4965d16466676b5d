package com.demochat.model.dto;

import java.util.Locale;

/**
 * Closed set of row changes announced by the storage layer. Each kind is
 * published on its own notification channel.
 */
public enum ChangeKind {
    INSERT("insert_message"),
    UPDATE("update_message"),
    DELETE("delete_message");

    private final String channelName;

    ChangeKind(String channelName) {
        this.channelName = channelName;
    }

    public String getChannelName() {
        return channelName;
    }

    /**
     * Resolves a notification channel name. The bare kind name
     * ({@code insert}, {@code update}, {@code delete}) is accepted as an alias.
     *
     * @return the matching kind, or {@code null} when the channel is not one of ours
     */
    public static ChangeKind fromChannel(String channel) {
        if (channel == null) {
            return null;
        }
        for (ChangeKind kind : values()) {
            if (kind.channelName.equals(channel) || kind.name().toLowerCase(Locale.ROOT).equals(channel)) {
                return kind;
            }
        }
        return null;
    }
}
