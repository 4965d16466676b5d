package com.demochat.repository;

import com.demochat.model.domain.ChatUser;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface ChatUserRepository extends JpaRepository<ChatUser, UUID> {
}
