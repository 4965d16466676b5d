package com.demochat.service.realtime;

import com.demochat.model.dto.RenderedEvent;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Receiving end of a viewer's live feed. Events arrive lazily and without
 * bound until either side closes the stream; a closed stream cannot be
 * reopened, the viewer subscribes again instead.
 */
public interface SubscriptionStream extends AutoCloseable {

    UUID subscriberId();

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the event, or empty when the timeout elapsed or the stream is closed
     */
    Optional<RenderedEvent> next(Duration timeout) throws InterruptedException;

    boolean isClosed();

    /**
     * Signals that the viewer went away. The topic worker notices on its next
     * delivery and drops the subscriber.
     */
    @Override
    void close();
}
