package com.demochat.service.realtime;

import com.demochat.model.dto.TopicKey;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * A viewer asking to join a topic's live feed.
 *
 * @param response one-shot slot the topic worker completes with the new stream.
 *                 A caller that gives up cancels it, which the worker then sees
 *                 as a failed {@code complete}.
 */
public record RegistrationRequest(
        TopicKey topic,
        UUID subscriberId,
        CompletableFuture<SubscriptionStream> response
) {
    public RegistrationRequest {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(response, "response");
    }

    public static RegistrationRequest of(TopicKey topic, UUID subscriberId) {
        return new RegistrationRequest(topic, subscriberId, new CompletableFuture<>());
    }
}
