package com.demochat.service.realtime;

import com.demochat.model.dto.ChangeEvent;
import com.demochat.service.LiveMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns raw storage notifications into routed change events.
 *
 * A notification that cannot be decoded is logged and skipped; the feed
 * keeps running.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeFeedProcessor {

    private final ChangeEventDecoder decoder;
    private final TopicDirectory topicDirectory;
    private final LiveMetricsService metricsService;

    /**
     * @return true if the notification was decoded and handed to the router
     */
    public boolean processNotification(String channel, String payload) {
        ChangeEvent event;
        try {
            event = decoder.decode(channel, payload);
        } catch (ChangeEventDecodeException ex) {
            log.warn("⚠️ [LIVE] Skipping notification on '{}' ({}): {}", channel, ex.getReason(), ex.getMessage());
            metricsService.recordDecodeFailure();
            return false;
        }

        log.debug("[LIVE] {} of message {} on channel {}", event.kind(), event.messageId(), event.channelId());
        if (!topicDirectory.routeEvent(event)) {
            log.warn("[LIVE] Router not accepting events, dropped {} of message {}", event.kind(), event.messageId());
            metricsService.recordDropped();
            return false;
        }
        return true;
    }
}
