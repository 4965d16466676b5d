package com.demochat.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Counters for the live fan-out. Workers and the router report here from
 * their own threads; Micrometer counters are thread safe.
 */
@Slf4j
@Service
public class LiveMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter deliveredCounter;
    private final Counter prunedCounter;
    private final Counter decodeFailureCounter;
    private final Counter droppedCounter;

    public LiveMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.deliveredCounter = meterRegistry.counter("live.events.delivered");
        this.prunedCounter = meterRegistry.counter("live.subscribers.pruned");
        this.decodeFailureCounter = meterRegistry.counter("live.feed.decode.failures");
        this.droppedCounter = meterRegistry.counter("live.events.dropped");
    }

    public void recordDelivered() {
        deliveredCounter.increment();
    }

    public void recordPruned(int count) {
        prunedCounter.increment(count);
        log.debug("Recorded pruned subscribers metric - Total: {}", prunedCounter.count());
    }

    public void recordDecodeFailure() {
        decodeFailureCounter.increment();
    }

    public void recordDropped() {
        droppedCounter.increment();
    }

    public void registerActiveTopics(Supplier<Number> activeTopics) {
        Gauge.builder("live.topics.active", activeTopics)
                .description("Topics with a running fan-out worker")
                .register(meterRegistry);
    }
}
