package com.livestockmart.marketplace.controller;

import com.livestockmart.marketplace.dto.OrderResponse;
import com.livestockmart.marketplace.dto.OrderStatusUpdateRequest;
import com.livestockmart.marketplace.dto.PaymentRejectionRequest;
import com.livestockmart.marketplace.model.OrderStatus;
import com.livestockmart.marketplace.service.OrderService;
import com.livestockmart.marketplace.service.PaymentProofService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Staff endpoints. Access is restricted to ROLE_STAFF in the security config.
 */
@RestController
@RequestMapping("/api/v1/admin/orders")
@RequiredArgsConstructor
public class AdminOrderController {

    private final OrderService orderService;
    private final PaymentProofService paymentProofService;

    @GetMapping
    public ResponseEntity<List<OrderResponse>> getAllOrders(
            @RequestParam(required = false) OrderStatus status) {
        return ResponseEntity.ok(orderService.getAllOrders(status));
    }

    @PutMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody OrderStatusUpdateRequest request) {
        return ResponseEntity.ok(orderService.setOrderStatus(orderId, request.getStatus()));
    }

    @PutMapping("/{orderId}/reject")
    public ResponseEntity<OrderResponse> rejectPayment(
            @PathVariable UUID orderId,
            @Valid @RequestBody(required = false) PaymentRejectionRequest request) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(paymentProofService.rejectPayment(orderId, reason));
    }

    @GetMapping("/{orderId}/payment-proof")
    public ResponseEntity<byte[]> getPaymentProof(@PathVariable UUID orderId) {
        return PaymentProofUploads.toResponse(paymentProofService.getProof(orderId));
    }
}
