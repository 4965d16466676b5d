package com.demochat.controller;

import com.demochat.config.LiveUpdateProperties;
import com.demochat.model.dto.RenderedEvent;
import com.demochat.model.dto.TopicKey;
import com.demochat.service.realtime.LiveUpdatesUnavailableException;
import com.demochat.service.realtime.SubscriptionGateway;
import com.demochat.service.realtime.SubscriptionStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static com.demochat.service.realtime.LiveUpdatesUnavailableException.Reason.STREAM_CAPACITY_EXHAUSTED;

/**
 * Server-sent events feed of a channel's message changes.
 */
@Slf4j
@RestController
public class LiveMessageController {

    static final String USER_HEADER = "X-Chat-User";
    static final String UNAVAILABLE_BODY = "Live updates unavailable";

    private final SubscriptionGateway subscriptionGateway;
    private final TaskExecutor streamExecutor;
    private final Duration heartbeatInterval;
    private final String heartbeatText;

    public LiveMessageController(SubscriptionGateway subscriptionGateway,
                                 @Qualifier("liveStreamExecutor") TaskExecutor streamExecutor,
                                 LiveUpdateProperties properties) {
        this.subscriptionGateway = subscriptionGateway;
        this.streamExecutor = streamExecutor;
        this.heartbeatInterval = properties.getHeartbeatInterval();
        this.heartbeatText = properties.getHeartbeatText();
    }

    @GetMapping("/servers/{serverId}/channels/{channelId}/messages/events")
    public SseEmitter streamMessages(@PathVariable UUID serverId,
                                     @PathVariable UUID channelId,
                                     @RequestHeader(USER_HEADER) UUID userId) {
        TopicKey topic = new TopicKey(channelId, serverId);
        SubscriptionStream stream = subscriptionGateway.subscribe(topic, userId);

        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(stream::close);
        emitter.onTimeout(stream::close);
        emitter.onError(ex -> stream.close());

        try {
            streamExecutor.execute(() -> pump(stream, emitter, channelId));
        } catch (TaskRejectedException ex) {
            stream.close();
            log.warn("⚠️ [LIVE] No streaming thread free for user {} on channel {}", userId, channelId);
            throw new LiveUpdatesUnavailableException(STREAM_CAPACITY_EXHAUSTED, topic, userId, ex);
        }
        log.info("📡 [LIVE] User {} streaming channel {}", userId, channelId);
        return emitter;
    }

    private void pump(SubscriptionStream stream, SseEmitter emitter, UUID channelId) {
        try {
            while (true) {
                Optional<RenderedEvent> next = stream.next(heartbeatInterval);
                if (next.isPresent()) {
                    RenderedEvent event = next.get();
                    emitter.send(SseEmitter.event().name(event.eventName()).data(event.data()));
                } else if (stream.isClosed()) {
                    break;
                } else {
                    emitter.send(SseEmitter.event().comment(heartbeatText));
                }
            }
            emitter.complete();
        } catch (IOException | IllegalStateException ex) {
            // Client disconnected or the emitter is already done
            log.debug("[LIVE] Stream of user {} on channel {} ended: {}",
                    stream.subscriberId(), channelId, ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } catch (RuntimeException ex) {
            log.error("❌ [LIVE] Stream of user {} on channel {} failed", stream.subscriberId(), channelId, ex);
            emitter.completeWithError(ex);
        } finally {
            stream.close();
        }
    }

    @ExceptionHandler(LiveUpdatesUnavailableException.class)
    public ResponseEntity<String> handleUnavailable(LiveUpdatesUnavailableException ex) {
        log.warn("❌ [LIVE] {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType(MediaType.TEXT_PLAIN)
                .body(UNAVAILABLE_BODY);
    }
}
