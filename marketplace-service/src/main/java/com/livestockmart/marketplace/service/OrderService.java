package com.livestockmart.marketplace.service;

import com.livestockmart.marketplace.dto.OrderRequest;
import com.livestockmart.marketplace.dto.OrderResponse;
import com.livestockmart.marketplace.dto.PaymentProofUpload;
import com.livestockmart.marketplace.model.OrderStatus;

import java.util.List;
import java.util.UUID;

public interface OrderService {

    /**
     * Reserves every listing of the request, then stores the order, its
     * optional payment proof, an emptied basket and the order.created event
     * in one transaction. If that transaction fails the reservation is released.
     *
     * @param paymentProof may be null
     * @throws com.livestockmart.marketplace.exception.ReservationConflictException if any listing is taken
     * @throws com.livestockmart.marketplace.exception.StorageFaultException if the order could not be stored
     */
    OrderResponse createOrder(UUID userId, String customerName, OrderRequest request, PaymentProofUpload paymentProof);

    /**
     * Buyer cancellation. Only the owner, only while PROCESSING.
     */
    OrderResponse cancelOrder(UUID orderId, UUID requesterId);

    /**
     * Staff status change, limited to the allowed transitions of {@link OrderStatus}.
     */
    OrderResponse setOrderStatus(UUID orderId, OrderStatus newStatus);

    List<OrderResponse> getMyOrders(UUID userId);

    OrderResponse getOrderById(UUID orderId, UUID requesterId);

    /**
     * Staff view of all orders, newest first. A null status returns every order.
     */
    List<OrderResponse> getAllOrders(OrderStatus status);
}
