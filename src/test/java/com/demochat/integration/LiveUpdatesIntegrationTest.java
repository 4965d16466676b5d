package com.demochat.integration;

import com.demochat.helper.TestUuids;
import com.demochat.model.domain.ChatMessage;
import com.demochat.model.domain.ChatUser;
import com.demochat.model.dto.ChangeKind;
import com.demochat.model.dto.RenderedEvent;
import com.demochat.model.dto.TopicKey;
import com.demochat.repository.ChatMessageRepository;
import com.demochat.repository.ChatUserRepository;
import com.demochat.service.realtime.ChangeFeedProcessor;
import com.demochat.service.realtime.SubscriptionGateway;
import com.demochat.service.realtime.SubscriptionStream;
import com.demochat.service.realtime.TopicDirectory;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End to end through the real store: notification in, rendered HTML out.
 */
@Slf4j
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Live updates integration")
class LiveUpdatesIntegrationTest {

    private static final Duration WAIT = Duration.ofSeconds(3);

    @Autowired
    private ChatUserRepository chatUserRepository;

    @Autowired
    private ChatMessageRepository chatMessageRepository;

    @Autowired
    private SubscriptionGateway subscriptionGateway;

    @Autowired
    private ChangeFeedProcessor changeFeedProcessor;

    @Autowired
    private TopicDirectory topicDirectory;

    private ChatUser author;
    private ChatUser reader;
    private TopicKey topic;

    @BeforeEach
    void setUp() {
        author = chatUserRepository.save(new ChatUser(UUID.randomUUID(), "ada"));
        reader = chatUserRepository.save(new ChatUser(UUID.randomUUID(), "grace"));
        topic = new TopicKey(UUID.randomUUID(), UUID.randomUUID());
    }

    @AfterEach
    void tearDown() {
        chatMessageRepository.deleteAll();
        chatUserRepository.deleteAll();
    }

    private ChatMessage saveMessage(String content) {
        Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        ChatMessage message = new ChatMessage(TestUuids.v7(createdAt), content,
                LocalDateTime.ofInstant(createdAt, ZoneOffset.UTC), topic.channelId(), author);
        return chatMessageRepository.save(message);
    }

    private static String payload(UUID messageId, UUID channelId) {
        return messageId.toString() + channelId;
    }

    private static RenderedEvent nextEvent(SubscriptionStream stream) throws InterruptedException {
        Optional<RenderedEvent> event = stream.next(WAIT);
        assertThat(event).isPresent();
        return event.get();
    }

    @Test
    @DisplayName("Should push inserts, edits and deletes to every viewer of the channel")
    void shouldPushMessageLifecycle() throws Exception {
        try (SubscriptionStream authorStream = subscriptionGateway.subscribe(topic, author.getId());
             SubscriptionStream readerStream = subscriptionGateway.subscribe(topic, reader.getId())) {

            // Insert
            ChatMessage message = saveMessage("first draft");
            assertThat(changeFeedProcessor.processNotification("insert_message",
                    payload(message.getId(), topic.channelId()))).isTrue();

            RenderedEvent insertForAuthor = nextEvent(authorStream);
            RenderedEvent insertForReader = nextEvent(readerStream);
            log.info("Rendered insert: {}", insertForAuthor.data());
            assertThat(insertForAuthor.kind()).isEqualTo(ChangeKind.INSERT);
            assertThat(insertForAuthor.data()).contains("chat-end", "first draft", "ada", ">Edit</button>");
            assertThat(insertForReader.data()).contains("chat-start", "first draft").doesNotContain(">Edit</button>");

            // Edit
            message.setContent("final version");
            message.setUpdated(message.getUpdated().plusMinutes(1));
            chatMessageRepository.save(message);
            changeFeedProcessor.processNotification("update_message", payload(message.getId(), topic.channelId()));

            RenderedEvent update = nextEvent(readerStream);
            assertThat(update.kind()).isEqualTo(ChangeKind.UPDATE);
            assertThat(update.data()).contains("hx-swap-oob=\"true\"", "Edited", "final version");
            assertThat(nextEvent(authorStream).kind()).isEqualTo(ChangeKind.UPDATE);

            // Delete
            chatMessageRepository.delete(message);
            changeFeedProcessor.processNotification("delete_message", payload(message.getId(), topic.channelId()));

            assertThat(nextEvent(authorStream).data()).contains("hx-swap-oob=\"delete\"");
            assertThat(nextEvent(readerStream).data()).contains("hx-swap-oob=\"delete\"");
        }
    }

    @Test
    @DisplayName("Should keep viewers of another channel out of the feed")
    void shouldIsolateChannels() throws Exception {
        TopicKey otherTopic = new TopicKey(UUID.randomUUID(), topic.serverId());

        try (SubscriptionStream u1 = subscriptionGateway.subscribe(topic, reader.getId());
             SubscriptionStream u2 = subscriptionGateway.subscribe(otherTopic, author.getId())) {

            ChatMessage message = saveMessage("only here");
            changeFeedProcessor.processNotification("insert", payload(message.getId(), topic.channelId()));

            RenderedEvent event = nextEvent(u1);
            assertThat(event.messageId()).isEqualTo(message.getId());
            assertThat(u2.next(Duration.ofMillis(300))).isEmpty();
            assertThat(topicDirectory.activeTopics()).isGreaterThanOrEqualTo(2);
        }
    }

    @Test
    @DisplayName("Should skip a notification for a message that is already gone")
    void shouldSkipVanishedMessage() throws Exception {
        try (SubscriptionStream stream = subscriptionGateway.subscribe(topic, reader.getId())) {
            changeFeedProcessor.processNotification("update_message", payload(UUID.randomUUID(), topic.channelId()));
            ChatMessage message = saveMessage("still delivered");
            changeFeedProcessor.processNotification("insert_message", payload(message.getId(), topic.channelId()));

            assertThat(nextEvent(stream).messageId()).isEqualTo(message.getId());
        }
    }
}
