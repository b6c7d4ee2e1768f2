package com.livestockmart.marketplace.job;

import com.livestockmart.marketplace.config.AmqpConfig;
import com.livestockmart.marketplace.model.OutboxEvent;
import com.livestockmart.marketplace.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Relays committed outbox rows to the broker. Delivery is at-least-once:
 * a row is marked processed only after the send returned.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final Duration RETENTION = Duration.ofDays(1);

    private final OutboxRepository outboxRepository;
    private final RabbitTemplate rabbitTemplate;

    @Scheduled(fixedDelayString = "${marketplace.outbox.poll-interval:2000}")
    @Transactional
    public void publishOutboxEvents() {
        List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();
        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} outbox events to publish", events.size());

        for (OutboxEvent event : events) {
            try {
                // payload is already JSON, send the bytes as they are
                MessageProperties props = new MessageProperties();
                props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
                props.setHeader("aggregateId", event.getAggregateId());
                Message message = new Message(event.getPayload().getBytes(StandardCharsets.UTF_8), props);

                rabbitTemplate.send(AmqpConfig.MARKETPLACE_EXCHANGE, event.getType(), message);

                event.setProcessed(true);
                outboxRepository.save(event);
                log.info("Published outbox event: id={}, type={}, aggregateId={}",
                        event.getId(), event.getType(), event.getAggregateId());
            } catch (Exception e) {
                // left unprocessed, retried on the next poll
                log.error("Failed to publish outbox event: id={}, type={}", event.getId(), event.getType(), e);
            }
        }
    }

    @Scheduled(cron = "${marketplace.outbox.cleanup-cron:0 0 3 * * *}")
    @Transactional
    public void cleanupProcessedEvents() {
        Instant cutoff = Instant.now().minus(RETENTION);
        log.info("Starting cleanup of processed outbox events older than {}", cutoff);

        int totalDeleted = 0;
        while (true) {
            List<OutboxEvent> batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
            if (batch.isEmpty()) {
                break;
            }
            outboxRepository.deleteAll(batch);
            totalDeleted += batch.size();
            log.debug("Deleted batch of {} processed events", batch.size());
        }

        log.info("Cleanup completed. Total deleted: {}", totalDeleted);
    }
}
