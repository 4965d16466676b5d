package com.demochat.service.realtime;

import com.demochat.model.dto.ChangeEvent;
import com.demochat.model.dto.ChangeKind;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

import static com.demochat.service.realtime.ChangeEventDecodeException.Reason.MALFORMED_IDENTIFIER;
import static com.demochat.service.realtime.ChangeEventDecodeException.Reason.MALFORMED_LENGTH;
import static com.demochat.service.realtime.ChangeEventDecodeException.Reason.UNRECOGNIZED_CHANNEL;

/**
 * Decodes the storage layer's message notifications.
 *
 * The trigger publishes {@code message_id || channel_id} as the payload: two
 * canonical 36 character UUIDs with no separator.
 */
@Component
public class ChangeEventDecoder {

    static final int UUID_LENGTH = 36;
    static final int PAYLOAD_LENGTH = UUID_LENGTH * 2;

    // UUID.fromString is lenient about group widths, so check the layout first
    private static final Pattern CANONICAL_UUID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    public ChangeEvent decode(String channel, String payload) {
        ChangeKind kind = ChangeKind.fromChannel(channel);
        if (kind == null) {
            throw new ChangeEventDecodeException(UNRECOGNIZED_CHANNEL, "Unexpected channel '" + channel + "'");
        }
        if (payload == null || payload.length() != PAYLOAD_LENGTH) {
            throw new ChangeEventDecodeException(MALFORMED_LENGTH,
                    "Payload must be exactly " + PAYLOAD_LENGTH + " characters, got "
                            + (payload == null ? "null" : payload.length()));
        }

        UUID messageId = parseId(payload.substring(0, UUID_LENGTH), "message id");
        UUID channelId = parseId(payload.substring(UUID_LENGTH), "channel id");
        return new ChangeEvent(kind, messageId, channelId);
    }

    private static UUID parseId(String text, String role) {
        if (!CANONICAL_UUID.matcher(text).matches()) {
            throw new ChangeEventDecodeException(MALFORMED_IDENTIFIER, "Invalid " + role + " '" + text + "'");
        }
        try {
            return UUID.fromString(text);
        } catch (IllegalArgumentException ex) {
            throw new ChangeEventDecodeException(MALFORMED_IDENTIFIER, "Invalid " + role + " '" + text + "'", ex);
        }
    }
}
