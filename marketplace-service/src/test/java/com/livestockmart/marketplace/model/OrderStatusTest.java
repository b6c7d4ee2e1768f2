package com.livestockmart.marketplace.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStatusTest {

    @Test
    void processing_AllowsEveryForwardMove() {
        assertThat(OrderStatus.PROCESSING.staffTargets()).containsExactlyInAnyOrder(
                OrderStatus.SHIPPED, OrderStatus.DELIVERED, OrderStatus.CANCELLED, OrderStatus.PAYMENT_REJECTED);
    }

    @Test
    void shipped_OnlyAllowsDelivered() {
        assertThat(OrderStatus.SHIPPED.staffTargets()).containsExactly(OrderStatus.DELIVERED);
        assertThat(OrderStatus.SHIPPED.canStaffTransitionTo(OrderStatus.PROCESSING)).isFalse();
        assertThat(OrderStatus.SHIPPED.canStaffTransitionTo(OrderStatus.CANCELLED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"DELIVERED", "CANCELLED"})
    void terminalStatuses_AllowNothing(OrderStatus status) {
        assertThat(status.isTerminal()).isTrue();
        assertThat(status.staffTargets()).isEmpty();
        assertThat(status.acceptsPaymentProof()).isFalse();
    }

    @Test
    void nobodyMovesBackToProcessing() {
        for (OrderStatus status : OrderStatus.values()) {
            assertThat(status.canStaffTransitionTo(OrderStatus.PROCESSING)).isFalse();
        }
    }

    @Test
    void proofAccepted_OnlyBeforeShipping() {
        assertThat(OrderStatus.PROCESSING.acceptsPaymentProof()).isTrue();
        assertThat(OrderStatus.PAYMENT_REJECTED.acceptsPaymentProof()).isTrue();
        assertThat(OrderStatus.SHIPPED.acceptsPaymentProof()).isFalse();
    }
}
