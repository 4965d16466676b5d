package com.demochat.repository;

import com.demochat.model.domain.ChatMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

    /**
     * Loads a message together with its author so it can be rendered outside a transaction.
     */
    @Query("SELECT m FROM ChatMessage m JOIN FETCH m.author WHERE m.id = :id")
    Optional<ChatMessage> findWithAuthorById(@Param("id") UUID id);
}
