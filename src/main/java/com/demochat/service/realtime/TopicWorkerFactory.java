package com.demochat.service.realtime;

import com.demochat.config.LiveUpdateProperties;
import com.demochat.model.dto.TopicKey;
import com.demochat.service.LiveMetricsService;
import com.demochat.store.MessageStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds topic workers wired to the shared store, renderer and metrics.
 */
@Component
@RequiredArgsConstructor
class TopicWorkerFactory {

    private final MessageStore messageStore;
    private final MessageRenderer messageRenderer;
    private final LiveMetricsService metricsService;
    private final LiveUpdateProperties properties;

    TopicWorker create(TopicKey topic, TopicWorker.RetirementListener retirementListener) {
        return new TopicWorker(
                topic,
                messageStore,
                messageRenderer,
                metricsService,
                retirementListener,
                properties.getWorkerIdleTimeout(),
                properties.getWorkerInboxCapacity());
    }
}
