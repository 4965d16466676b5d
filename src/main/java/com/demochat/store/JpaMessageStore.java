package com.demochat.store;

import com.demochat.model.domain.ChatMessage;
import com.demochat.model.dto.LiveMessage;
import com.demochat.repository.ChatMessageRepository;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * {@link MessageStore} backed by the relational store.
 *
 * Every fan-out worker reads through this class concurrently. The circuit
 * breaker makes workers fail fast while the database is unreachable instead
 * of each one waiting on the connection pool.
 */
@Slf4j
@Component
public class JpaMessageStore implements MessageStore {

    static final String CIRCUIT_BREAKER_NAME = "messageStore";

    private final ChatMessageRepository chatMessageRepository;
    private final CircuitBreaker circuitBreaker;

    public JpaMessageStore(ChatMessageRepository chatMessageRepository,
                           CircuitBreakerRegistry cbRegistry) {
        this.chatMessageRepository = chatMessageRepository;

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .ignoreExceptions(MessageNotFoundException.class)
                .build();
        this.circuitBreaker = cbRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME, cbConfig);
    }

    CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    @Override
    public LiveMessage fetchMessage(UUID messageId) {
        try {
            return circuitBreaker.executeSupplier(() -> loadMessage(messageId));
        } catch (CallNotPermittedException ex) {
            log.warn("[LIVE] Message store circuit is {}, not fetching message {}", circuitBreaker.getState(), messageId);
            throw new MessageStoreException("Message store unavailable", ex);
        } catch (DataAccessException ex) {
            log.error("[LIVE] Failed to load message {}: {}", messageId, ex.getMessage());
            throw new MessageStoreException("Failed to load message " + messageId, ex);
        }
    }

    private LiveMessage loadMessage(UUID messageId) {
        ChatMessage message = chatMessageRepository.findWithAuthorById(messageId)
                .orElseThrow(() -> new MessageNotFoundException(messageId));
        return new LiveMessage(
                message.getId(),
                message.getContent(),
                message.getUpdated(),
                message.getAuthor().getId(),
                message.getAuthor().getName());
    }
}
