package com.demochat.service.realtime;

import com.demochat.config.LiveUpdateProperties;
import com.demochat.model.dto.TopicKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.demochat.service.realtime.LiveUpdatesUnavailableException.Reason.REGISTRATION_CHANNEL_CLOSED;
import static com.demochat.service.realtime.LiveUpdatesUnavailableException.Reason.RESPONSE_NOT_RECEIVED;

/**
 * Entry point for viewers: turns a topic and a viewer id into a live stream.
 */
@Slf4j
@Service
public class SubscriptionGateway {

    private final TopicDirectory topicDirectory;
    private final Duration registrationTimeout;

    public SubscriptionGateway(TopicDirectory topicDirectory, LiveUpdateProperties properties) {
        this.topicDirectory = topicDirectory;
        this.registrationTimeout = properties.getRegistrationTimeout();
    }

    /**
     * Registers the viewer on the topic and waits for the worker to hand back
     * its stream. The stream starts with the first change after registration;
     * nothing earlier is replayed.
     *
     * @throws LiveUpdatesUnavailableException if the router refuses the request
     *         or no stream arrives within the registration timeout
     */
    public SubscriptionStream subscribe(TopicKey topic, UUID subscriberId) {
        RegistrationRequest request = RegistrationRequest.of(topic, subscriberId);
        if (!topicDirectory.routeRegistration(request)) {
            log.warn("⚠️ [LIVE] Router refused subscriber {} on channel {}", subscriberId, topic.channelId());
            throw new LiveUpdatesUnavailableException(REGISTRATION_CHANNEL_CLOSED, topic, subscriberId, null);
        }

        CompletableFuture<SubscriptionStream> response = request.response();
        try {
            SubscriptionStream stream = response.get(registrationTimeout.toNanos(), TimeUnit.NANOSECONDS);
            log.debug("[LIVE] Subscriber {} streaming channel {}", subscriberId, topic.channelId());
            return stream;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abandon(response);
            throw new LiveUpdatesUnavailableException(RESPONSE_NOT_RECEIVED, topic, subscriberId, ex);
        } catch (TimeoutException | CancellationException ex) {
            log.warn("⚠️ [LIVE] No stream for subscriber {} on channel {} within {}",
                    subscriberId, topic.channelId(), registrationTimeout);
            abandon(response);
            throw new LiveUpdatesUnavailableException(RESPONSE_NOT_RECEIVED, topic, subscriberId, ex);
        } catch (ExecutionException ex) {
            log.warn("⚠️ [LIVE] Registration of subscriber {} on channel {} failed: {}",
                    subscriberId, topic.channelId(), ex.getCause().getMessage());
            throw new LiveUpdatesUnavailableException(RESPONSE_NOT_RECEIVED, topic, subscriberId, ex.getCause());
        }
    }

    /**
     * Gives up on a pending registration. If the worker won the race the
     * stream is closed so the worker prunes it on its next delivery.
     */
    private static void abandon(CompletableFuture<SubscriptionStream> response) {
        if (!response.cancel(false) && !response.isCompletedExceptionally()) {
            response.join().close();
        }
    }
}
