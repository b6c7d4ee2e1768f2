package com.livestockmart.marketplace.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.livestockmart.common.contracts.PaymentRejectedContract;
import com.livestockmart.marketplace.model.OutboxEvent;
import com.livestockmart.marketplace.repository.OutboxRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OutboxEventWriterTest {

    @Mock
    private OutboxRepository outboxRepository;

    @Spy
    private ObjectMapper objectMapper = new ObjectMapper(); // real JSON serialization

    @InjectMocks
    private OutboxEventWriter outboxEventWriter;

    @BeforeEach
    void setUp() {
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Test
    void saveOrderEvent_WritesUnprocessedRowWithJsonPayload() {
        UUID orderId = UUID.randomUUID();
        PaymentRejectedContract contract = PaymentRejectedContract.builder()
                .orderId(orderId)
                .userId(UUID.randomUUID())
                .reason("Blurry photo")
                .occurredAt(Instant.parse("2024-05-01T10:15:30Z"))
                .build();

        outboxEventWriter.saveOrderEvent(orderId, OutboxEventWriter.ORDER_PAYMENT_REJECTED, contract);

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxRepository).save(captor.capture());
        OutboxEvent event = captor.getValue();
        assertThat(event.getAggregateType()).isEqualTo("ORDER");
        assertThat(event.getAggregateId()).isEqualTo(orderId.toString());
        assertThat(event.getType()).isEqualTo("order.payment_rejected");
        assertThat(event.isProcessed()).isFalse();
        assertThat(event.getPayload())
                .contains(orderId.toString())
                .contains("\"reason\":\"Blurry photo\"")
                .contains("2024-05-01T10:15:30Z");
    }
}
