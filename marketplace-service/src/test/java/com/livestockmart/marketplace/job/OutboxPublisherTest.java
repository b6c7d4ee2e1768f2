package com.livestockmart.marketplace.job;

import com.livestockmart.marketplace.config.AmqpConfig;
import com.livestockmart.marketplace.model.OutboxEvent;
import com.livestockmart.marketplace.repository.OutboxRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxPublisher Unit Tests")
class OutboxPublisherTest {

    @Mock
    private OutboxRepository outboxRepository;

    @Mock
    private RabbitTemplate rabbitTemplate;

    @InjectMocks
    private OutboxPublisher publisher;

    private OutboxEvent createOutboxEvent(String type) {
        UUID orderId = UUID.randomUUID();
        return OutboxEvent.builder()
                .id(UUID.randomUUID())
                .aggregateType("ORDER")
                .aggregateId(orderId.toString())
                .type(type)
                .payload("{\"orderId\":\"" + orderId + "\"}")
                .createdAt(Instant.now())
                .processed(false)
                .build();
    }

    @Nested
    @DisplayName("publishOutboxEvents Tests")
    class PublishOutboxEventsTests {

        @Test
        @DisplayName("should do nothing when the outbox is empty")
        void shouldDoNothingWhenEmpty() {
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc()).thenReturn(List.of());

            publisher.publishOutboxEvents();

            verifyNoInteractions(rabbitTemplate);
        }

        @Test
        @DisplayName("should send raw JSON to the marketplace exchange with the event type as routing key")
        void shouldSendRawJson() {
            OutboxEvent event = createOutboxEvent("order.payment_rejected");
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc()).thenReturn(List.of(event));

            publisher.publishOutboxEvents();

            ArgumentCaptor<Message> messageCaptor = ArgumentCaptor.forClass(Message.class);
            verify(rabbitTemplate).send(eq(AmqpConfig.MARKETPLACE_EXCHANGE), eq("order.payment_rejected"),
                    messageCaptor.capture());
            Message message = messageCaptor.getValue();
            assertThat(new String(message.getBody(), StandardCharsets.UTF_8)).isEqualTo(event.getPayload());
            assertThat(message.getMessageProperties().getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
            assertThat(event.isProcessed()).isTrue();
            verify(outboxRepository).save(event);
        }

        @Test
        @DisplayName("should keep a failed event unprocessed and continue with the rest")
        void shouldContinueWhenOneFails() {
            OutboxEvent failing = createOutboxEvent("order.created");
            OutboxEvent succeeding = createOutboxEvent("order.cancelled");
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc())
                    .thenReturn(List.of(failing, succeeding));
            doThrow(new AmqpConnectException(new ConnectException("broker down")))
                    .when(rabbitTemplate).send(anyString(), eq("order.created"), any(Message.class));

            publisher.publishOutboxEvents();

            assertThat(failing.isProcessed()).isFalse();
            assertThat(succeeding.isProcessed()).isTrue();
            verify(outboxRepository, never()).save(failing);
            verify(outboxRepository).save(succeeding);
        }
    }

    @Nested
    @DisplayName("cleanupProcessedEvents Tests")
    class CleanupTests {

        @Test
        @DisplayName("should delete in batches until nothing is left")
        void shouldDeleteInBatches() {
            List<OutboxEvent> batch = List.of(createOutboxEvent("order.created"), createOutboxEvent("order.created"));
            when(outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(any(Instant.class)))
                    .thenReturn(batch)
                    .thenReturn(List.of());

            publisher.cleanupProcessedEvents();

            verify(outboxRepository, times(1)).deleteAll(batch);
            verify(outboxRepository, times(2)).findTop1000ByProcessedTrueAndCreatedAtBefore(any(Instant.class));
        }
    }
}
