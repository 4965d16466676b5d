package com.demochat.service.realtime;

import com.demochat.config.LiveUpdateProperties;
import com.demochat.model.dto.ChangeEvent;
import com.demochat.model.dto.TopicKey;
import com.demochat.service.LiveMetricsService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Router between the change feed, the viewers and the per-topic workers.
 *
 * A single thread drains the inbox and is the only owner of the directory of
 * running workers. Events and registrations are forwarded to the worker of
 * their channel in arrival order; events for a channel nobody watches are
 * dropped here.
 */
@Slf4j
@Service
public class TopicDirectory {

    private interface RouterCommand {
    }

    private record RouteEvent(ChangeEvent event) implements RouterCommand {
    }

    private record Register(RegistrationRequest request) implements RouterCommand {
    }

    private record Retire(TopicWorker worker, long processedCount) implements RouterCommand {
    }

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final TopicWorkerFactory workerFactory;
    private final LiveMetricsService metricsService;
    private final Duration registrationTimeout;
    private final BlockingQueue<RouterCommand> inbox;
    private final AtomicInteger activeTopics = new AtomicInteger();

    // Router thread only
    private final Map<UUID, TopicWorker> workers = new HashMap<>();

    private volatile Thread routerThread;
    private volatile boolean running;

    public TopicDirectory(TopicWorkerFactory workerFactory,
                          LiveMetricsService metricsService,
                          LiveUpdateProperties properties) {
        this.workerFactory = workerFactory;
        this.metricsService = metricsService;
        this.registrationTimeout = properties.getRegistrationTimeout();
        this.inbox = new ArrayBlockingQueue<>(properties.getRouterInboxCapacity());
        metricsService.registerActiveTopics(activeTopics::get);
    }

    @PostConstruct
    public void start() {
        running = true;
        routerThread = new Thread(this::run, "live-router");
        routerThread.setDaemon(true);
        routerThread.start();
        log.info("🚀 [LIVE] Topic router started");
    }

    @PreDestroy
    public void stop() {
        running = false;
        Thread thread = routerThread;
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(SHUTDOWN_GRACE.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        log.info("[LIVE] Topic router stopped");
    }

    /**
     * Queues a change for its channel's worker, waiting while the inbox is full.
     *
     * @return false if the router is not running or the caller was interrupted
     */
    public boolean routeEvent(ChangeEvent event) {
        if (!running) {
            return false;
        }
        try {
            inbox.put(new RouteEvent(event));
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("[LIVE] Interrupted while routing {} of message {}", event.kind(), event.messageId());
            return false;
        }
    }

    /**
     * Queues a registration, waiting at most the registration timeout.
     *
     * @return false if the router did not accept the request
     */
    public boolean routeRegistration(RegistrationRequest request) {
        if (!running) {
            return false;
        }
        try {
            return inbox.offer(new Register(request), registrationTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Number of topics with a running worker.
     */
    public int activeTopics() {
        return activeTopics.get();
    }

    // ==================== ROUTER LOOP ====================

    private void run() {
        try {
            while (running) {
                RouterCommand command = inbox.take();
                try {
                    handle(command);
                } catch (RuntimeException ex) {
                    log.error("❌ [LIVE] Unexpected error while routing {}", command, ex);
                }
            }
        } catch (InterruptedException ex) {
            log.debug("[LIVE] Topic router interrupted");
        } finally {
            shutdownWorkers();
        }
    }

    private void handle(RouterCommand command) throws InterruptedException {
        if (command instanceof RouteEvent routeEvent) {
            routeToWorker(routeEvent.event());
        } else if (command instanceof Register register) {
            register(register.request());
        } else if (command instanceof Retire retire) {
            retire(retire.worker(), retire.processedCount());
        }
    }

    private void routeToWorker(ChangeEvent event) throws InterruptedException {
        TopicWorker worker = workers.get(event.channelId());
        if (worker == null) {
            log.debug("[LIVE] No topic for channel {}, dropping {} of message {}",
                    event.channelId(), event.kind(), event.messageId());
            metricsService.recordDropped();
            return;
        }
        if (!worker.forwardEvent(event)) {
            log.warn("[LIVE] Worker of channel {} stopped, dropping {} of message {}",
                    event.channelId(), event.kind(), event.messageId());
            removeWorker(worker);
            metricsService.recordDropped();
        }
    }

    private void register(RegistrationRequest request) throws InterruptedException {
        TopicKey topic = request.topic();
        TopicWorker worker = workers.get(topic.channelId());
        if (worker != null && !worker.isAlive()) {
            log.warn("[LIVE] Replacing stopped worker of channel {}", topic.channelId());
            removeWorker(worker);
            worker = null;
        }
        if (worker == null) {
            worker = workerFactory.create(topic, this::requestRetirement);
            workers.put(topic.channelId(), worker);
            activeTopics.set(workers.size());
            worker.start();
            log.info("[LIVE] Opened topic for channel {} ({} active)", topic.channelId(), workers.size());
        }

        if (!worker.forwardRegistration(request, registrationTimeout)) {
            log.warn("[LIVE] Worker of channel {} did not accept subscriber {}", topic.channelId(), request.subscriberId());
            request.response().completeExceptionally(new RegistrationFailedException(
                    "Topic for channel " + topic.channelId() + " did not accept the registration"));
        }
    }

    /**
     * Called on a worker thread. Never blocks: a full inbox just means the
     * worker asks again after its next idle period. The request is dropped by
     * the router when anything was forwarded after {@code processedCount}.
     */
    boolean requestRetirement(TopicWorker worker, long processedCount) {
        return running && inbox.offer(new Retire(worker, processedCount));
    }

    private void retire(TopicWorker worker, long processedCount) {
        UUID channelId = worker.topic().channelId();
        if (workers.get(channelId) != worker) {
            return;
        }
        // Something was forwarded after the worker went idle; it has work again
        if (worker.forwardedCount() != processedCount) {
            log.debug("[LIVE] Channel {} got new work, keeping its worker", channelId);
            return;
        }
        removeWorker(worker);
        worker.retire();
        log.info("[LIVE] Closed idle topic for channel {} ({} active)", channelId, workers.size());
    }

    private void removeWorker(TopicWorker worker) {
        workers.remove(worker.topic().channelId(), worker);
        activeTopics.set(workers.size());
    }

    private void shutdownWorkers() {
        running = false;
        List<TopicWorker> stopping = new ArrayList<>(workers.values());
        workers.clear();
        activeTopics.set(0);
        stopping.forEach(TopicWorker::shutdown);

        List<RouterCommand> pending = new ArrayList<>();
        inbox.drainTo(pending);
        for (RouterCommand command : pending) {
            if (command instanceof Register register) {
                register.request().response().completeExceptionally(
                        new RegistrationFailedException("Live updates are shutting down"));
            }
        }

        for (TopicWorker worker : stopping) {
            try {
                if (!worker.awaitTermination(SHUTDOWN_GRACE)) {
                    log.warn("[LIVE] Worker of channel {} did not stop in time", worker.topic().channelId());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
