package com.demochat.model.dto;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Read model of a message joined with its author's display name.
 *
 * @param updated UTC time of the last edit
 */
public record LiveMessage(
        UUID id,
        String content,
        LocalDateTime updated,
        UUID authorId,
        String authorName
) { }
