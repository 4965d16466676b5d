package com.demochat.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the live message fan-out.
 *
 * Inbox capacities bound how far the change feed can run ahead of a slow
 * topic; timeouts bound how long an HTTP request waits for its stream.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.live")
public class LiveUpdateProperties {

    /** Pending commands (events, registrations, retirements) the router buffers. */
    private int routerInboxCapacity = 64;

    /** Pending commands a single topic worker buffers before the router blocks. */
    private int workerInboxCapacity = 1;

    /** Upper bound on the registration handshake seen by the HTTP caller. */
    private Duration registrationTimeout = Duration.ofSeconds(5);

    /** Idle time after which a worker without subscribers is retired. Zero keeps workers forever. */
    private Duration workerIdleTimeout = Duration.ofMinutes(10);

    /** Keep-alive period of the SSE stream. */
    private Duration heartbeatInterval = Duration.ofSeconds(5);

    /** Comment text sent as keep-alive. */
    private String heartbeatText = "heartbeat";

    /** SSE event name the page swaps on. */
    private String eventName = "message";

    /** Maximum number of concurrently streaming viewers. */
    private int streamPoolSize = 256;
}
