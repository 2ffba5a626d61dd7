package com.dotplatform.order.event;

import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.entity.OrderType;

import java.time.LocalDateTime;

public record OrderStatusChangedEvent(
        Long orderId,
        OrderType orderType,
        Long customerId,
        Long driverId,
        OrderStatus previousStatus,
        OrderStatus status,
        Long changedBy,
        LocalDateTime occurredAt
) {
}
