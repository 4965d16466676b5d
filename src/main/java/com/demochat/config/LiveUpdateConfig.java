package com.demochat.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(LiveUpdateProperties.class)
public class LiveUpdateConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One thread per streaming viewer. No queue: a viewer that cannot get a
     * thread is rejected immediately rather than left with a silent stream.
     */
    @Bean(name = "liveStreamExecutor")
    public ThreadPoolTaskExecutor liveStreamExecutor(LiveUpdateProperties properties) {
        log.info("Initializing liveStreamExecutor with {} threads", properties.getStreamPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getStreamPoolSize());
        executor.setMaxPoolSize(properties.getStreamPoolSize());
        executor.setQueueCapacity(0);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("live-stream-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
