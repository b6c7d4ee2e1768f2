package com.livestockmart.marketplace.event;

import com.livestockmart.marketplace.dto.NotificationRequest;
import com.livestockmart.marketplace.model.NotificationSeverity;
import com.livestockmart.marketplace.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns committed order events into inbox notifications for the buyer.
 * A failed append is logged and dropped; the order change already committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderNotificationListener {

    static final String PAYMENT_REJECTED_TITLE = "Payment Rejected";
    static final String PAYMENT_REJECTED_ICON = "alert-circle";

    private final NotificationService notificationService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPaymentRejected(PaymentRejectedEvent event) {
        NotificationRequest request = NotificationRequest.builder()
                .orderId(event.getOrderId())
                .title(PAYMENT_REJECTED_TITLE)
                .message("Order #" + shortOrderId(event) + " proof rejected: " + event.getReason())
                .icon(PAYMENT_REJECTED_ICON)
                .severity(NotificationSeverity.DANGER)
                .build();
        try {
            notificationService.notify(event.getUserId(), request);
        } catch (Exception e) {
            log.error("Failed to notify buyer of payment rejection: orderId={}, userId={}, error={}",
                    event.getOrderId(), event.getUserId(), e.getMessage(), e);
        }
    }

    // last 6 characters of the id, the form buyers see on their order list
    private static String shortOrderId(PaymentRejectedEvent event) {
        String id = event.getOrderId().toString();
        return id.substring(id.length() - 6);
    }
}
