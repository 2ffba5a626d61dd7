package com.dotplatform.order.entity;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Order lifecycle.
 *
 * <pre>
 *   PENDING → ACCEPTED → PICKED_UP → (IN_TRANSIT) → DELIVERED → COMPLETED
 *      └──────────┴──────────┴────────────┴─────────────┴──→ CANCELLED
 * </pre>
 *
 * COMPLETED and CANCELLED are terminal. Any pair not listed in the transition table is illegal.
 */
public enum OrderStatus {
    PENDING,
    ACCEPTED,
    PICKED_UP,
    IN_TRANSIT,
    DELIVERED,
    COMPLETED,
    CANCELLED;

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(ACCEPTED, CANCELLED));
        TRANSITIONS.put(ACCEPTED, EnumSet.of(PICKED_UP, CANCELLED));
        TRANSITIONS.put(PICKED_UP, EnumSet.of(IN_TRANSIT, DELIVERED, CANCELLED));
        TRANSITIONS.put(IN_TRANSIT, EnumSet.of(DELIVERED, CANCELLED));
        TRANSITIONS.put(DELIVERED, EnumSet.of(COMPLETED, CANCELLED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
    }

    public boolean canTransitionTo(OrderStatus next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Statuses a driver may request through a progress update. ACCEPTED and CANCELLED have their
     * own operations.
     */
    public boolean isDriverProgressStatus() {
        return this == PICKED_UP || this == IN_TRANSIT || this == DELIVERED || this == COMPLETED;
    }
}
