package com.demochat.service.realtime;

import com.demochat.model.dto.RenderedEvent;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded single-writer, single-reader channel between a topic worker and
 * one viewer. Writing never blocks, so a stalled viewer cannot hold up the
 * worker or the other viewers of the topic.
 */
final class DeliveryChannel implements SubscriptionStream {

    // Wakes a blocked reader once the channel is closed
    private static final RenderedEvent END_OF_STREAM = new RenderedEvent(null, null, null, null);

    private final UUID subscriberId;
    private final LinkedBlockingQueue<RenderedEvent> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    DeliveryChannel(UUID subscriberId) {
        this.subscriberId = subscriberId;
    }

    /**
     * Writer side, called by the owning worker only.
     *
     * @return false when the reader has gone away
     */
    boolean offer(RenderedEvent event) {
        if (closed) {
            return false;
        }
        queue.add(event);
        return true;
    }

    @Override
    public UUID subscriberId() {
        return subscriberId;
    }

    @Override
    public Optional<RenderedEvent> next(Duration timeout) throws InterruptedException {
        RenderedEvent event = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (event == END_OF_STREAM) {
            queue.add(END_OF_STREAM); // keep later calls from blocking
            return Optional.empty();
        }
        return Optional.ofNullable(event);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            queue.add(END_OF_STREAM);
        }
    }
}
