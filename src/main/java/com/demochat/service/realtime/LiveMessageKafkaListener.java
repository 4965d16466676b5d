package com.demochat.service.realtime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Consumes the message change notifications relayed from the database.
 * The topic name is the notification channel and the record value its payload.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class LiveMessageKafkaListener {

    private final ChangeFeedProcessor processor;

    @KafkaListener(
            id = "liveMessageListener",
            topics = "#{'${app.live.feed.topics:insert_message,update_message,delete_message}'.split(',')}",
            groupId = "${app.live.feed.group-id:demo-chat-live}")
    public void consume(ConsumerRecord<String, String> record) {
        if (record.value() == null) {
            log.warn("[LIVE] Empty notification on {} at offset {}, skipping", record.topic(), record.offset());
            return;
        }
        processor.processNotification(record.topic(), record.value());
    }
}
