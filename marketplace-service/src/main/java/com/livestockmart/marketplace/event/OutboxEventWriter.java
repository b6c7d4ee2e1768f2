package com.livestockmart.marketplace.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livestockmart.marketplace.model.OutboxEvent;
import com.livestockmart.marketplace.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Appends order events to the outbox table. Only valid inside the transaction
 * that changes the order, so the event and the change commit or roll back together.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxEventWriter {

    public static final String AGGREGATE_ORDER = "ORDER";

    public static final String ORDER_CREATED = "order.created";
    public static final String ORDER_CANCELLED = "order.cancelled";
    public static final String ORDER_STATUS_CHANGED = "order.status_changed";
    public static final String ORDER_PAYMENT_REJECTED = "order.payment_rejected";
    public static final String ORDER_PROOF_SUBMITTED = "order.proof_submitted";

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void saveOrderEvent(UUID orderId, String type, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize outbox payload. orderId={}, type={}", orderId, type, e);
            throw new IllegalStateException("Failed to serialize outbox event " + type, e);
        }

        OutboxEvent event = OutboxEvent.builder()
                .aggregateType(AGGREGATE_ORDER)
                .aggregateId(orderId.toString())
                .type(type)
                .payload(json)
                .createdAt(Instant.now())
                .build();
        outboxRepository.save(event);
        log.info("'{}' event saved to Outbox. orderId={}", type, orderId);
    }
}
