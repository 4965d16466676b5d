package com.demochat.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LiveUpdateProperties Tests")
class LiveUpdatePropertiesTest {

    private static LiveUpdateProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("app.live", LiveUpdateProperties.class);
    }

    @Test
    @DisplayName("Should bind relaxed names and duration units")
    void shouldBindConfiguredValues() {
        // When
        LiveUpdateProperties properties = bind(Map.of(
                "app.live.router-inbox-capacity", "16",
                "app.live.registration-timeout", "750ms",
                "app.live.worker-idle-timeout", "0s",
                "app.live.heartbeat-text", "ping",
                "app.live.stream-pool-size", "4"));

        // Then
        assertThat(properties.getRouterInboxCapacity()).isEqualTo(16);
        assertThat(properties.getRegistrationTimeout()).isEqualTo(Duration.ofMillis(750));
        assertThat(properties.getWorkerIdleTimeout()).isZero();
        assertThat(properties.getHeartbeatText()).isEqualTo("ping");
        assertThat(properties.getStreamPoolSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should fall back to defaults and ignore the feed keys read by the listener")
    void shouldKeepDefaults() {
        // When
        LiveUpdateProperties properties = bind(Map.of(
                "app.live.feed.topics", "insert_message",
                "app.live.feed.group-id", "other"));

        // Then
        assertThat(properties.getRouterInboxCapacity()).isEqualTo(64);
        assertThat(properties.getWorkerInboxCapacity()).isEqualTo(1);
        assertThat(properties.getRegistrationTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(properties.getWorkerIdleTimeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(properties.getHeartbeatInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(properties.getEventName()).isEqualTo("message");
    }
}
