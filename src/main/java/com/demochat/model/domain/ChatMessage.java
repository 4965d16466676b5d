package com.demochat.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * A row of the {@code messages} table.
 *
 * The live engine never writes this entity; inserts, edits and deletes are
 * performed by the chat CRUD layer and reach us through the change feed.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "messages")
public class ChatMessage {
    @Id
    private UUID id; // UUIDv7, the creation time is encoded in the id

    @Column(nullable = false, length = 4000)
    private String content;

    // UTC wall-clock time of the last edit, equal to the creation time until edited
    @Column(nullable = false)
    private LocalDateTime updated;

    @Column(name = "channel", nullable = false)
    private UUID channelId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author", nullable = false)
    private ChatUser author;

    public ChatMessage(UUID id, String content, LocalDateTime updated, UUID channelId, ChatUser author) {
        this.id = id;
        this.content = content;
        this.updated = updated;
        this.channelId = channelId;
        this.author = author;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChatMessage that = (ChatMessage) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ChatMessage{" +
                "id=" + id +
                ", channelId=" + channelId +
                ", updated=" + updated +
                '}';
    }
}
