package com.demochat.service.realtime;

import com.demochat.model.dto.TopicKey;

import java.util.UUID;

/**
 * The viewer cannot be given a live feed. Surfaced to the HTTP layer so the
 * page can show that live updates are unavailable.
 */
public class LiveUpdatesUnavailableException extends RuntimeException {

    public enum Reason {
        /** The router did not accept the registration. */
        REGISTRATION_CHANNEL_CLOSED,
        /** The registration was accepted but no stream came back in time. */
        RESPONSE_NOT_RECEIVED,
        /** Every streaming thread is busy. */
        STREAM_CAPACITY_EXHAUSTED
    }

    private final Reason reason;

    public LiveUpdatesUnavailableException(Reason reason, TopicKey topic, UUID subscriberId, Throwable cause) {
        super("Live updates unavailable for subscriber " + subscriberId + " on channel "
                + topic.channelId() + ": " + reason, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
