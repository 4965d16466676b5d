package com.demochat.service.realtime;

import com.demochat.model.dto.ChangeEvent;
import com.demochat.model.dto.ChangeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ChangeEventDecoder Tests")
class ChangeEventDecoderTest {

    private static final String MESSAGE_ID = "0190a2b4-7c1e-7a3b-9d4e-5f6a7b8c9d0e";
    private static final String CHANNEL_ID = "11111111-2222-4333-8444-555555555555";

    private final ChangeEventDecoder decoder = new ChangeEventDecoder();

    @Nested
    @DisplayName("Well-formed notifications")
    class WellFormed {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "insert_message, INSERT",
                "update_message, UPDATE",
                "delete_message, DELETE",
                "insert, INSERT",
                "update, UPDATE",
                "delete, DELETE"
        })
        @DisplayName("Should map every known channel to its kind")
        void shouldMapChannelToKind(String channel, ChangeKind expected) {
            // When
            ChangeEvent event = decoder.decode(channel, MESSAGE_ID + CHANNEL_ID);

            // Then
            assertThat(event.kind()).isEqualTo(expected);
            assertThat(event.messageId()).isEqualTo(UUID.fromString(MESSAGE_ID));
            assertThat(event.channelId()).isEqualTo(UUID.fromString(CHANNEL_ID));
        }

        @Test
        @DisplayName("Should accept upper-case hex digits")
        void shouldAcceptUpperCaseHex() {
            // When
            ChangeEvent event = decoder.decode("update_message", (MESSAGE_ID + CHANNEL_ID).toUpperCase());

            // Then
            assertThat(event.messageId()).isEqualTo(UUID.fromString(MESSAGE_ID));
        }
    }

    @Nested
    @DisplayName("Rejected notifications")
    class Rejected {

        @Test
        @DisplayName("Should reject an unknown channel before looking at the payload")
        void shouldRejectUnknownChannel() {
            assertThatThrownBy(() -> decoder.decode("truncate_message", "garbage"))
                    .isInstanceOf(ChangeEventDecodeException.class)
                    .extracting(ex -> ((ChangeEventDecodeException) ex).getReason())
                    .isEqualTo(ChangeEventDecodeException.Reason.UNRECOGNIZED_CHANNEL);
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource({"INSERT", "Update", "Delete_Message", "'insert_message '"})
        @DisplayName("Should match channel names exactly")
        void shouldRejectChannelVariants(String channel) {
            assertThatThrownBy(() -> decoder.decode(channel, MESSAGE_ID + CHANNEL_ID))
                    .isInstanceOf(ChangeEventDecodeException.class)
                    .extracting(ex -> ((ChangeEventDecodeException) ex).getReason())
                    .isEqualTo(ChangeEventDecodeException.Reason.UNRECOGNIZED_CHANNEL);
        }

        @Test
        @DisplayName("Should reject a null channel")
        void shouldRejectNullChannel() {
            assertThatThrownBy(() -> decoder.decode(null, MESSAGE_ID + CHANNEL_ID))
                    .isInstanceOf(ChangeEventDecodeException.class)
                    .extracting(ex -> ((ChangeEventDecodeException) ex).getReason())
                    .isEqualTo(ChangeEventDecodeException.Reason.UNRECOGNIZED_CHANNEL);
        }

        @Test
        @DisplayName("Should reject a payload that is one character short")
        void shouldRejectShortPayload() {
            String payload = (MESSAGE_ID + CHANNEL_ID).substring(1);

            assertThatThrownBy(() -> decoder.decode("insert_message", payload))
                    .isInstanceOf(ChangeEventDecodeException.class)
                    .extracting(ex -> ((ChangeEventDecodeException) ex).getReason())
                    .isEqualTo(ChangeEventDecodeException.Reason.MALFORMED_LENGTH);
        }

        @Test
        @DisplayName("Should reject a payload with a separator between the ids")
        void shouldRejectSeparatedPayload() {
            assertThatThrownBy(() -> decoder.decode("insert_message", MESSAGE_ID + ":" + CHANNEL_ID))
                    .isInstanceOf(ChangeEventDecodeException.class)
                    .extracting(ex -> ((ChangeEventDecodeException) ex).getReason())
                    .isEqualTo(ChangeEventDecodeException.Reason.MALFORMED_LENGTH);
        }

        @Test
        @DisplayName("Should reject a null payload")
        void shouldRejectNullPayload() {
            assertThatThrownBy(() -> decoder.decode("delete_message", null))
                    .isInstanceOf(ChangeEventDecodeException.class)
                    .extracting(ex -> ((ChangeEventDecodeException) ex).getReason())
                    .isEqualTo(ChangeEventDecodeException.Reason.MALFORMED_LENGTH);
        }

        @Test
        @DisplayName("Should reject a payload of the right length with a broken id")
        void shouldRejectMalformedIdentifier() {
            String brokenMessageId = "0190a2b4_7c1e-7a3b-9d4e-5f6a7b8c9d0e";

            assertThatThrownBy(() -> decoder.decode("insert_message", brokenMessageId + CHANNEL_ID))
                    .isInstanceOf(ChangeEventDecodeException.class)
                    .extracting(ex -> ((ChangeEventDecodeException) ex).getReason())
                    .isEqualTo(ChangeEventDecodeException.Reason.MALFORMED_IDENTIFIER);
        }

        @Test
        @DisplayName("Should reject a broken channel id")
        void shouldRejectMalformedChannelId() {
            String brokenChannelId = "zzzzzzzz-2222-4333-8444-555555555555";

            assertThatThrownBy(() -> decoder.decode("update_message", MESSAGE_ID + brokenChannelId))
                    .isInstanceOf(ChangeEventDecodeException.class)
                    .extracting(ex -> ((ChangeEventDecodeException) ex).getReason())
                    .isEqualTo(ChangeEventDecodeException.Reason.MALFORMED_IDENTIFIER);
        }
    }
}
