package com.dotplatform.order.event;

import com.dotplatform.order.entity.OrderType;

import java.time.LocalDateTime;

/**
 * Published inside the creating transaction; listeners act after commit.
 * {@code recipientPhone} and {@code recipientLocationToken} are null for taxi orders.
 */
public record OrderCreatedEvent(
        Long orderId,
        OrderType orderType,
        Long customerId,
        String recipientPhone,
        String recipientLocationToken,
        LocalDateTime createdAt
) {
}
