package com.livestockmart.marketplace.model;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    PROCESSING,
    PAYMENT_REJECTED,   // Staff rejected the proof; owner may resubmit
    SHIPPED,
    DELIVERED,
    CANCELLED;

    /**
     * Targets a staff member may set directly from this status.
     * DELIVERED and CANCELLED are terminal.
     */
    public Set<OrderStatus> staffTargets() {
        switch (this) {
            case PROCESSING:
            case PAYMENT_REJECTED:
                return EnumSet.of(SHIPPED, DELIVERED, CANCELLED, PAYMENT_REJECTED);
            case SHIPPED:
                return EnumSet.of(DELIVERED);
            default:
                return EnumSet.noneOf(OrderStatus.class);
        }
    }

    public boolean canStaffTransitionTo(OrderStatus target) {
        return staffTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    public boolean acceptsPaymentProof() {
        return this == PROCESSING || this == PAYMENT_REJECTED;
    }
}
