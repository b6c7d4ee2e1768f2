package com.livestockmart.marketplace.controller;

import com.livestockmart.marketplace.dto.OrderRequest;
import com.livestockmart.marketplace.dto.OrderResponse;
import com.livestockmart.marketplace.service.OrderService;
import com.livestockmart.marketplace.service.PaymentProofService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;
    private final PaymentProofService paymentProofService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> createOrder(
            @Valid @RequestBody OrderRequest orderRequest,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.createOrder(userId(jwt), customerName(jwt), orderRequest, null);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<OrderResponse> createOrderWithProof(
            @Valid @RequestPart("order") OrderRequest orderRequest,
            @RequestPart(value = "paymentProof", required = false) MultipartFile paymentProof,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.createOrder(userId(jwt), customerName(jwt), orderRequest,
                paymentProof == null ? null : PaymentProofUploads.fromMultipart(paymentProof));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/my-orders")
    public ResponseEntity<List<OrderResponse>> getMyOrders(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getMyOrders(userId(jwt)));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getOrderById(orderId, userId(jwt)));
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.cancelOrder(orderId, userId(jwt)));
    }

    @PutMapping(value = "/{orderId}/payment-proof", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<OrderResponse> resubmitPaymentProof(
            @PathVariable UUID orderId,
            @RequestPart("file") MultipartFile file,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = paymentProofService.resubmitProof(orderId, userId(jwt),
                PaymentProofUploads.fromMultipart(file));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{orderId}/payment-proof")
    public ResponseEntity<byte[]> getPaymentProof(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return PaymentProofUploads.toResponse(paymentProofService.getProofForOwner(orderId, userId(jwt)));
    }

    private static UUID userId(Jwt jwt) {
        return UUID.fromString(jwt.getSubject());
    }

    // Display name for staff screens; falls back through the usual Keycloak claims
    private static String customerName(Jwt jwt) {
        for (String claim : List.of("name", "preferred_username", "email")) {
            String value = jwt.getClaimAsString(claim);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
