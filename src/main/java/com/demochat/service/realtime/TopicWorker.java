package com.demochat.service.realtime;

import com.demochat.model.dto.ChangeEvent;
import com.demochat.model.dto.LiveMessage;
import com.demochat.model.dto.RenderedEvent;
import com.demochat.model.dto.TopicKey;
import com.demochat.service.LiveMetricsService;
import com.demochat.store.MessageNotFoundException;
import com.demochat.store.MessageStore;
import com.demochat.store.MessageStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fan-out worker of a single topic.
 *
 * Owns the topic's subscribers and processes its mailbox one command at a
 * time on a dedicated thread. The subscriber map is only ever touched by that
 * thread, and the mailbox order is the delivery order seen by every viewer.
 *
 * Only the {@link TopicDirectory} router thread puts commands in the mailbox.
 */
@Slf4j
class TopicWorker {

    /**
     * Callback into the router when the worker has been idle without subscribers.
     */
    @FunctionalInterface
    interface RetirementListener {
        /**
         * @param processedCount commands this worker has taken from its mailbox so far
         * @return false when the request could not be queued
         */
        boolean requestRetirement(TopicWorker worker, long processedCount);
    }

    private interface Command {
    }

    private record Deliver(ChangeEvent event) implements Command {
    }

    private record Register(RegistrationRequest request) implements Command {
    }

    private enum Stop implements Command {
        INSTANCE
    }

    private static final long LIVENESS_CHECK_MILLIS = 500;

    private final TopicKey topic;
    private final MessageStore messageStore;
    private final MessageRenderer renderer;
    private final LiveMetricsService metrics;
    private final RetirementListener retirementListener;
    private final Duration idleTimeout;
    private final BlockingQueue<Command> mailbox;
    private final Thread thread;

    // Worker thread only
    private final Map<UUID, DeliveryChannel> subscribers = new LinkedHashMap<>();
    private long processedCount;

    // Router thread only
    private long forwardedCount;

    private volatile boolean terminated;

    TopicWorker(TopicKey topic,
                MessageStore messageStore,
                MessageRenderer renderer,
                LiveMetricsService metrics,
                RetirementListener retirementListener,
                Duration idleTimeout,
                int mailboxCapacity) {
        this.topic = topic;
        this.messageStore = messageStore;
        this.renderer = renderer;
        this.metrics = metrics;
        this.retirementListener = retirementListener;
        this.idleTimeout = idleTimeout;
        this.mailbox = new ArrayBlockingQueue<>(mailboxCapacity);
        this.thread = new Thread(this::run, "live-topic-" + topic.channelId());
        this.thread.setDaemon(true);
    }

    TopicKey topic() {
        return topic;
    }

    void start() {
        thread.start();
    }

    boolean isAlive() {
        return !terminated && thread.isAlive();
    }

    // ==================== ROUTER SIDE ====================

    /**
     * Hands an event to the worker, waiting while its mailbox is full.
     *
     * @return false if the worker terminated before accepting the event
     */
    boolean forwardEvent(ChangeEvent event) throws InterruptedException {
        Deliver command = new Deliver(event);
        while (!mailbox.offer(command, LIVENESS_CHECK_MILLIS, TimeUnit.MILLISECONDS)) {
            if (!isAlive()) {
                return false;
            }
        }
        forwardedCount++;
        return true;
    }

    /**
     * Hands a registration to the worker, waiting at most {@code timeout}.
     *
     * @return false if the mailbox stayed full or the worker is gone
     */
    boolean forwardRegistration(RegistrationRequest request, Duration timeout) throws InterruptedException {
        if (!isAlive()) {
            return false;
        }
        if (!mailbox.offer(new Register(request), timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        forwardedCount++;
        return true;
    }

    long forwardedCount() {
        return forwardedCount;
    }

    /**
     * Stops a worker the router has already removed from its directory. The
     * mailbox is empty at this point, so the stop command is taken next.
     */
    void retire() {
        if (!mailbox.offer(Stop.INSTANCE)) {
            log.warn("[LIVE] Mailbox of topic {} not empty on retirement, interrupting", topic.channelId());
            thread.interrupt();
        }
    }

    /**
     * Interrupts the worker during shutdown. Open streams are closed on exit.
     */
    void shutdown() {
        thread.interrupt();
    }

    boolean awaitTermination(Duration timeout) throws InterruptedException {
        thread.join(Math.max(1, timeout.toMillis()));
        return !thread.isAlive();
    }

    // ==================== WORKER LOOP ====================

    private void run() {
        log.info("[LIVE] Topic worker started for channel {} (server {})", topic.channelId(), topic.serverId());
        try {
            while (true) {
                Command command = idleTimeout.isZero()
                        ? mailbox.take()
                        : mailbox.poll(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (command == null) {
                    onIdle();
                    continue;
                }
                if (command == Stop.INSTANCE) {
                    log.info("[LIVE] Topic worker for channel {} retired", topic.channelId());
                    break;
                }
                processedCount++;
                try {
                    handle(command);
                } catch (RuntimeException ex) {
                    log.error("[LIVE] Unexpected error in topic worker for channel {} while handling {}",
                            topic.channelId(), command, ex);
                }
            }
        } catch (InterruptedException ex) {
            log.debug("[LIVE] Topic worker for channel {} interrupted", topic.channelId());
            Thread.currentThread().interrupt();
        } finally {
            terminated = true;
            subscribers.values().forEach(DeliveryChannel::close);
            subscribers.clear();
        }
    }

    private void handle(Command command) {
        if (command instanceof Register register) {
            register(register.request());
        } else if (command instanceof Deliver deliver) {
            dispatch(deliver.event());
        }
    }

    private void onIdle() {
        int pruned = pruneClosed();
        if (pruned > 0) {
            log.debug("[LIVE] Dropped {} closed subscriber(s) from idle channel {}", pruned, topic.channelId());
        }
        if (subscribers.isEmpty() && !retirementListener.requestRetirement(this, processedCount)) {
            log.debug("[LIVE] Router busy, channel {} will ask for retirement again later", topic.channelId());
        }
    }

    // ==================== REGISTRATION ====================

    private void register(RegistrationRequest request) {
        UUID subscriberId = request.subscriberId();
        DeliveryChannel channel = new DeliveryChannel(subscriberId);

        DeliveryChannel replaced = subscribers.put(subscriberId, channel);
        if (replaced != null) {
            log.debug("[LIVE] Subscriber {} re-registered on channel {}, closing previous stream",
                    subscriberId, topic.channelId());
            replaced.close();
        }

        if (request.response().complete(channel)) {
            log.info("✅ [LIVE] Subscriber {} joined channel {} ({} subscriber(s))",
                    subscriberId, topic.channelId(), subscribers.size());
        } else {
            // Nobody will read this channel; the next delivery fails and prunes it
            log.debug("[LIVE] Subscriber {} abandoned its registration on channel {}", subscriberId, topic.channelId());
            channel.close();
        }
    }

    // ==================== EVENT DISPATCH ====================

    private void dispatch(ChangeEvent event) {
        if (subscribers.isEmpty()) {
            log.debug("[LIVE] No subscribers on channel {}, skipping {} of message {}",
                    topic.channelId(), event.kind(), event.messageId());
            return;
        }

        List<UUID> stale = new ArrayList<>();
        switch (event.kind()) {
            case INSERT, UPDATE -> {
                LiveMessage message = fetch(event);
                if (message == null) {
                    return;
                }
                for (Map.Entry<UUID, DeliveryChannel> subscriber : subscribers.entrySet()) {
                    RenderedEvent rendered;
                    try {
                        rendered = renderer.renderMessage(message, topic, subscriber.getKey(), event.kind());
                    } catch (MessageRenderException ex) {
                        log.warn("[LIVE] Could not render {} of message {} for subscriber {} on channel {}: {}",
                                event.kind(), event.messageId(), subscriber.getKey(), topic.channelId(), ex.getMessage());
                        continue;
                    }
                    deliver(subscriber.getKey(), subscriber.getValue(), rendered, stale);
                }
            }
            case DELETE -> {
                RenderedEvent rendered = renderer.renderDeletion(event.messageId());
                for (Map.Entry<UUID, DeliveryChannel> subscriber : subscribers.entrySet()) {
                    deliver(subscriber.getKey(), subscriber.getValue(), rendered, stale);
                }
            }
        }

        for (UUID subscriberId : stale) {
            log.debug("[LIVE] Removing stale subscriber {} from channel {}", subscriberId, topic.channelId());
            subscribers.remove(subscriberId);
        }
        if (!stale.isEmpty()) {
            metrics.recordPruned(stale.size());
        }
    }

    private LiveMessage fetch(ChangeEvent event) {
        try {
            return messageStore.fetchMessage(event.messageId());
        } catch (MessageNotFoundException ex) {
            log.warn("[LIVE] {} of message {} on channel {} skipped: message no longer exists",
                    event.kind(), event.messageId(), topic.channelId());
        } catch (MessageStoreException ex) {
            log.error("[LIVE] {} of message {} on channel {} skipped: {}",
                    event.kind(), event.messageId(), topic.channelId(), ex.getMessage(), ex);
        }
        metrics.recordDropped();
        return null;
    }

    private void deliver(UUID subscriberId, DeliveryChannel channel, RenderedEvent rendered, List<UUID> stale) {
        if (channel.offer(rendered)) {
            metrics.recordDelivered();
        } else {
            stale.add(subscriberId);
        }
    }

    private int pruneClosed() {
        int before = subscribers.size();
        subscribers.values().removeIf(DeliveryChannel::isClosed);
        int pruned = before - subscribers.size();
        if (pruned > 0) {
            metrics.recordPruned(pruned);
        }
        return pruned;
    }
}
