package com.livestockmart.marketplace.service;

import com.livestockmart.common.contracts.OrderStatusChangeContract;
import com.livestockmart.common.exception.AccessDeniedException;
import com.livestockmart.common.exception.ResourceNotFoundException;
import com.livestockmart.marketplace.dto.OrderItemRequest;
import com.livestockmart.marketplace.dto.OrderRequest;
import com.livestockmart.marketplace.dto.OrderResponse;
import com.livestockmart.marketplace.dto.PaymentProofUpload;
import com.livestockmart.marketplace.dto.ReservationResult;
import com.livestockmart.marketplace.event.OutboxEventWriter;
import com.livestockmart.marketplace.exception.InvalidOrderStateException;
import com.livestockmart.marketplace.exception.ReservationConflictException;
import com.livestockmart.marketplace.exception.StorageFaultException;
import com.livestockmart.marketplace.mapper.OrderMapper;
import com.livestockmart.marketplace.model.Listing;
import com.livestockmart.marketplace.model.Order;
import com.livestockmart.marketplace.model.OrderItem;
import com.livestockmart.marketplace.model.OrderStatus;
import com.livestockmart.marketplace.repository.ListingRepository;
import com.livestockmart.marketplace.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    private final OrderRepository orderRepository;
    private final ListingRepository listingRepository;
    private final OrderMapper orderMapper;
    private final ReservationCoordinator reservationCoordinator;
    private final PaymentProofService paymentProofService;
    private final BasketService basketService;
    private final OutboxEventWriter outboxEventWriter;
    private final TransactionTemplate transactionTemplate;

    // Not @Transactional: the reservation commits on its own first, and the
    // order is written in a second transaction that is undone by a release
    @Override
    public OrderResponse createOrder(UUID userId, String customerName, OrderRequest request,
                                     PaymentProofUpload paymentProof) {
        log.info("Order creation process started. userId={}, itemCount={}", userId, request.getItems().size());

        Set<UUID> listingIds = collectListingIds(request);
        if (paymentProof != null) {
            paymentProofService.validateUpload(paymentProof);
        }

        Map<UUID, Listing> listings = listingRepository.findAllById(listingIds).stream()
                .collect(Collectors.toMap(Listing::getId, Function.identity()));
        BigDecimal catalogTotal = BigDecimal.ZERO;
        for (OrderItemRequest item : request.getItems()) {
            Listing listing = listings.get(item.getListingId());
            if (listing == null) {
                log.warn("Listing not found in catalog: listingId={}", item.getListingId());
                throw new ResourceNotFoundException("Listing not found: " + item.getListingId());
            }
            if (listing.getPrice().compareTo(item.getPrice()) != 0) {
                log.warn("Client price out of date: listingId={}, client={}, catalog={}",
                        listing.getId(), item.getPrice(), listing.getPrice());
                throw new IllegalArgumentException("Price of listing " + listing.getId()
                        + " has changed to " + listing.getPrice() + ". Please refresh your basket.");
            }
            catalogTotal = catalogTotal.add(listing.getPrice());
        }

        ReservationResult reservation = reservationCoordinator.reserve(listingIds);
        if (!reservation.isSuccessful()) {
            log.warn("Order creation refused, listings taken: userId={}, conflictingIds={}",
                    userId, reservation.getConflictingIds());
            throw new ReservationConflictException(reservation.getConflictingIds());
        }

        BigDecimal totalAmount = catalogTotal;
        try {
            Order saved = transactionTemplate.execute(status ->
                    persistOrder(userId, customerName, request, listings, totalAmount, paymentProof));
            log.info("Order created: orderId={}, userId={}, total={}", saved.getId(), userId, totalAmount);
            return orderMapper.toOrderResponse(saved);
        } catch (RuntimeException e) {
            releaseAfterFailedCreation(listingIds, e);
            if (e instanceof DataAccessException || e instanceof TransactionException) {
                throw new StorageFaultException("Order could not be stored. Your reservation was released, please retry.", e);
            }
            throw e;
        }
    }

    private Order persistOrder(UUID userId, String customerName, OrderRequest request,
                               Map<UUID, Listing> listings, BigDecimal totalAmount,
                               PaymentProofUpload paymentProof) {
        Order order = new Order();
        order.setUserId(userId);
        order.setCustomerName(customerName);
        order.setShippingAddress(request.getShippingAddress());
        order.setStatus(OrderStatus.PROCESSING);
        order.setTotalAmount(totalAmount);
        for (OrderItemRequest item : request.getItems()) {
            order.addItem(OrderItem.snapshotOf(listings.get(item.getListingId())));
        }
        Order saved = orderRepository.save(order);

        if (paymentProof != null) {
            paymentProofService.attachProof(saved, paymentProof);
        }
        basketService.clearBasket(userId);

        outboxEventWriter.saveOrderEvent(saved.getId(), OutboxEventWriter.ORDER_CREATED,
                statusChange(saved, null));
        return saved;
    }

    private void releaseAfterFailedCreation(Set<UUID> listingIds, RuntimeException cause) {
        log.error("Order persistence failed, releasing reservation: listingIds={}, error={}",
                listingIds, cause.getMessage());
        try {
            reservationCoordinator.release(listingIds);
        } catch (RuntimeException releaseError) {
            // listings stay RESERVED until staff release them by hand
            log.error("Release after failed order creation also failed: listingIds={}", listingIds, releaseError);
            cause.addSuppressed(releaseError);
        }
    }

    private Set<UUID> collectListingIds(OrderRequest request) {
        Set<UUID> listingIds = new LinkedHashSet<>();
        BigDecimal itemSum = BigDecimal.ZERO;
        for (OrderItemRequest item : request.getItems()) {
            if (!listingIds.add(item.getListingId())) {
                throw new IllegalArgumentException("Listing appears more than once in order: " + item.getListingId());
            }
            itemSum = itemSum.add(item.getPrice());
        }
        if (itemSum.compareTo(request.getTotal()) != 0) {
            throw new IllegalArgumentException("Order total " + request.getTotal()
                    + " does not match the sum of item prices " + itemSum);
        }
        return listingIds;
    }

    @Override
    @Transactional
    public OrderResponse cancelOrder(UUID orderId, UUID requesterId) {
        log.info("Cancel order process started. orderId={}, userId={}", orderId, requesterId);
        Order order = findOrder(orderId);

        if (!order.getUserId().equals(requesterId)) {
            log.warn("Unauthorized cancel attempt: orderId={}, requester={}, owner={}",
                    orderId, requesterId, order.getUserId());
            throw new AccessDeniedException("You can only cancel your own orders");
        }
        if (order.getStatus() != OrderStatus.PROCESSING) {
            log.warn("Cancel refused: orderId={}, status={}", orderId, order.getStatus());
            throw new InvalidOrderStateException(
                    "Order can only be cancelled while PROCESSING. Current status: " + order.getStatus());
        }

        return orderMapper.toOrderResponse(applyCancellation(order));
    }

    @Override
    @Transactional
    public OrderResponse setOrderStatus(UUID orderId, OrderStatus newStatus) {
        log.info("Order status update started. orderId={}, newStatus={}", orderId, newStatus);
        Order order = findOrder(orderId);
        OrderStatus oldStatus = order.getStatus();

        if (!oldStatus.canStaffTransitionTo(newStatus)) {
            log.warn("Illegal status transition: orderId={}, {} -> {}", orderId, oldStatus, newStatus);
            throw new InvalidOrderStateException(
                    "Cannot change order status from " + oldStatus + " to " + newStatus);
        }

        if (newStatus == OrderStatus.PAYMENT_REJECTED) {
            return paymentProofService.rejectPayment(orderId, null);
        }
        if (newStatus == OrderStatus.CANCELLED) {
            return orderMapper.toOrderResponse(applyCancellation(order));
        }

        order.setStatus(newStatus);
        order.setRejectionReason("");
        Order saved = orderRepository.save(order);
        outboxEventWriter.saveOrderEvent(saved.getId(), OutboxEventWriter.ORDER_STATUS_CHANGED,
                statusChange(saved, oldStatus));

        log.info("Order status updated: orderId={}, {} -> {}", orderId, oldStatus, newStatus);
        return orderMapper.toOrderResponse(saved);
    }

    private Order applyCancellation(Order order) {
        OrderStatus oldStatus = order.getStatus();
        order.setStatus(OrderStatus.CANCELLED);
        order.setRejectionReason("");
        Order saved = orderRepository.save(order);

        reservationCoordinator.release(new LinkedHashSet<>(saved.listingIds()));
        outboxEventWriter.saveOrderEvent(saved.getId(), OutboxEventWriter.ORDER_CANCELLED,
                statusChange(saved, oldStatus));

        log.info("Order cancelled: orderId={}, previousStatus={}", saved.getId(), oldStatus);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getMyOrders(UUID userId) {
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderById(UUID orderId, UUID requesterId) {
        Order order = findOrder(orderId);
        if (!order.getUserId().equals(requesterId)) {
            log.warn("Unauthorized order access: orderId={}, requester={}", orderId, requesterId);
            throw new AccessDeniedException("You are not authorized to view this order");
        }
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getAllOrders(OrderStatus status) {
        List<Order> orders = status == null
                ? orderRepository.findAllByOrderByCreatedAtDesc()
                : orderRepository.findByStatusOrderByCreatedAtDesc(status);
        return orders.stream()
                .map(orderMapper::toOrderResponse)
                .toList();
    }

    private Order findOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
    }

    private OrderStatusChangeContract statusChange(Order order, OrderStatus oldStatus) {
        return OrderStatusChangeContract.builder()
                .orderId(order.getId())
                .userId(order.getUserId())
                .oldStatus(oldStatus == null ? null : oldStatus.name())
                .status(order.getStatus().name())
                .totalAmount(order.getTotalAmount())
                .listingIds(order.listingIds())
                .occurredAt(Instant.now())
                .build();
    }
}
