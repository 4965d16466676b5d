package com.demochat.service.realtime;

/**
 * A change notification that cannot be turned into a {@link com.demochat.model.dto.ChangeEvent}.
 * Never reaches subscribers: the feed logs it and moves on.
 */
public class ChangeEventDecodeException extends RuntimeException {

    public enum Reason {
        UNRECOGNIZED_CHANNEL,
        MALFORMED_LENGTH,
        MALFORMED_IDENTIFIER
    }

    private final Reason reason;

    public ChangeEventDecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ChangeEventDecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
