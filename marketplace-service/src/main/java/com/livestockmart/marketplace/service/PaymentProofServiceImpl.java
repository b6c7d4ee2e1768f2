package com.livestockmart.marketplace.service;

import com.livestockmart.common.contracts.OrderStatusChangeContract;
import com.livestockmart.common.contracts.PaymentRejectedContract;
import com.livestockmart.common.exception.AccessDeniedException;
import com.livestockmart.common.exception.ResourceNotFoundException;
import com.livestockmart.marketplace.dto.OrderResponse;
import com.livestockmart.marketplace.dto.PaymentProofContent;
import com.livestockmart.marketplace.dto.PaymentProofUpload;
import com.livestockmart.marketplace.event.OutboxEventWriter;
import com.livestockmart.marketplace.event.PaymentRejectedEvent;
import com.livestockmart.marketplace.exception.InvalidOrderStateException;
import com.livestockmart.marketplace.exception.InvalidPaymentProofException;
import com.livestockmart.marketplace.mapper.OrderMapper;
import com.livestockmart.marketplace.model.Order;
import com.livestockmart.marketplace.model.OrderStatus;
import com.livestockmart.marketplace.model.PaymentProof;
import com.livestockmart.marketplace.repository.OrderRepository;
import com.livestockmart.marketplace.repository.PaymentProofRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.unit.DataSize;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@Slf4j
public class PaymentProofServiceImpl implements PaymentProofService {

    // Raster images and PDF only; the stored type is served back verbatim on download
    private static final List<MediaType> ACCEPTED_TYPES = List.of(
            MediaType.IMAGE_JPEG,
            MediaType.IMAGE_PNG,
            MediaType.IMAGE_GIF,
            MediaType.parseMediaType("image/webp"),
            MediaType.APPLICATION_PDF);

    private final OrderRepository orderRepository;
    private final PaymentProofRepository paymentProofRepository;
    private final OrderMapper orderMapper;
    private final OutboxEventWriter outboxEventWriter;
    private final ApplicationEventPublisher eventPublisher;
    private final DataSize maxSize;

    public PaymentProofServiceImpl(OrderRepository orderRepository,
                                   PaymentProofRepository paymentProofRepository,
                                   OrderMapper orderMapper,
                                   OutboxEventWriter outboxEventWriter,
                                   ApplicationEventPublisher eventPublisher,
                                   @Value("${marketplace.payment-proof.max-size:5MB}") DataSize maxSize) {
        this.orderRepository = orderRepository;
        this.paymentProofRepository = paymentProofRepository;
        this.orderMapper = orderMapper;
        this.outboxEventWriter = outboxEventWriter;
        this.eventPublisher = eventPublisher;
        this.maxSize = maxSize;
    }

    @Override
    public void validateUpload(PaymentProofUpload upload) {
        if (upload == null || upload.getContent() == null || upload.getContent().length == 0) {
            throw new InvalidPaymentProofException("Payment proof file is empty");
        }
        if (upload.getContent().length > maxSize.toBytes()) {
            throw new InvalidPaymentProofException(
                    "Payment proof exceeds the maximum size of " + maxSize.toMegabytes() + "MB");
        }
        proofMediaType(upload.getContentType());
    }

    private MediaType proofMediaType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            throw new InvalidPaymentProofException("Payment proof has no content type");
        }
        MediaType mediaType;
        try {
            mediaType = MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            log.warn("Unparseable payment proof content type: contentType={}", contentType);
            throw new InvalidPaymentProofException("Payment proof has an invalid content type: " + contentType);
        }
        return ACCEPTED_TYPES.stream()
                .filter(accepted -> accepted.equalsTypeAndSubtype(mediaType))
                .findFirst()
                .orElseThrow(() -> new InvalidPaymentProofException(
                        "Payment proof must be a JPEG, PNG, GIF or WebP image or a PDF, got: " + contentType));
    }

    @Override
    @Transactional
    public void attachProof(Order order, PaymentProofUpload upload) {
        validateUpload(upload);
        if (!order.getStatus().acceptsPaymentProof()) {
            log.warn("Proof rejected for order in wrong state: orderId={}, status={}",
                    order.getId(), order.getStatus());
            throw new InvalidOrderStateException(
                    "Payment proof can only be attached while the order is PROCESSING or PAYMENT_REJECTED. Current status: "
                            + order.getStatus());
        }

        Instant now = Instant.now();
        PaymentProof proof = paymentProofRepository.findById(order.getId())
                .orElseGet(() -> PaymentProof.builder().orderId(order.getId()).build());
        proof.setContentType(proofMediaType(upload.getContentType()).toString());
        proof.setContent(upload.getContent());
        proof.setSizeBytes(upload.getContent().length);
        proof.setUploadedAt(now);
        paymentProofRepository.save(proof);

        order.setProofUploadedAt(now);
        order.setRejectionReason("");
        if (order.getStatus() == OrderStatus.PAYMENT_REJECTED) {
            order.setStatus(OrderStatus.PROCESSING);
        }
        log.info("Payment proof stored: orderId={}, contentType={}, sizeBytes={}",
                order.getId(), proof.getContentType(), upload.getContent().length);
    }

    @Override
    @Transactional
    public OrderResponse resubmitProof(UUID orderId, UUID requesterId, PaymentProofUpload upload) {
        log.info("Payment proof resubmission started. orderId={}, userId={}", orderId, requesterId);
        Order order = findOrder(orderId);
        if (!order.getUserId().equals(requesterId)) {
            log.warn("Unauthorized proof resubmission: orderId={}, requester={}, owner={}",
                    orderId, requesterId, order.getUserId());
            throw new AccessDeniedException("You can only submit payment proof for your own orders");
        }

        OrderStatus oldStatus = order.getStatus();
        attachProof(order, upload);
        Order saved = orderRepository.save(order);

        OrderStatusChangeContract contract = OrderStatusChangeContract.builder()
                .orderId(saved.getId())
                .userId(saved.getUserId())
                .oldStatus(oldStatus.name())
                .status(saved.getStatus().name())
                .totalAmount(saved.getTotalAmount())
                .listingIds(saved.listingIds())
                .occurredAt(Instant.now())
                .build();
        outboxEventWriter.saveOrderEvent(saved.getId(), OutboxEventWriter.ORDER_PROOF_SUBMITTED, contract);

        log.info("Payment proof resubmitted: orderId={}, {} -> {}", orderId, oldStatus, saved.getStatus());
        return orderMapper.toOrderResponse(saved);
    }

    @Override
    @Transactional
    public OrderResponse rejectPayment(UUID orderId, String reason) {
        log.info("Payment rejection started. orderId={}", orderId);
        Order order = findOrder(orderId);
        if (order.getStatus() != OrderStatus.PROCESSING) {
            log.warn("Payment rejection refused: orderId={}, status={}", orderId, order.getStatus());
            throw new InvalidOrderStateException(
                    "Payment can only be rejected while the order is PROCESSING. Current status: " + order.getStatus());
        }

        String effectiveReason = (reason == null || reason.isBlank()) ? DEFAULT_REJECTION_REASON : reason.trim();
        order.setStatus(OrderStatus.PAYMENT_REJECTED);
        order.setRejectionReason(effectiveReason);
        Order saved = orderRepository.save(order);

        PaymentRejectedContract contract = PaymentRejectedContract.builder()
                .orderId(saved.getId())
                .userId(saved.getUserId())
                .reason(effectiveReason)
                .occurredAt(Instant.now())
                .build();
        outboxEventWriter.saveOrderEvent(saved.getId(), OutboxEventWriter.ORDER_PAYMENT_REJECTED, contract);

        eventPublisher.publishEvent(new PaymentRejectedEvent(saved.getId(), saved.getUserId(), effectiveReason));

        log.info("Payment rejected: orderId={}, reason={}", orderId, effectiveReason);
        return orderMapper.toOrderResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public PaymentProofContent getProof(UUID orderId) {
        findOrder(orderId);
        return loadProof(orderId);
    }

    @Override
    @Transactional(readOnly = true)
    public PaymentProofContent getProofForOwner(UUID orderId, UUID requesterId) {
        Order order = findOrder(orderId);
        if (!order.getUserId().equals(requesterId)) {
            log.warn("Unauthorized proof access: orderId={}, requester={}", orderId, requesterId);
            throw new AccessDeniedException("You can only view payment proof of your own orders");
        }
        return loadProof(orderId);
    }

    private PaymentProofContent loadProof(UUID orderId) {
        PaymentProof proof = paymentProofRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("No payment proof uploaded for order: " + orderId));
        return PaymentProofContent.builder()
                .contentType(proof.getContentType())
                .content(proof.getContent())
                .uploadedAt(proof.getUploadedAt())
                .build();
    }

    private Order findOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
    }
}
