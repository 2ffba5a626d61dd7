package com.dotplatform.order.event;

import com.dotplatform.order.entity.OrderStatus;

import java.time.LocalDateTime;

public record RecipientLocationSubmittedEvent(
        Long orderId,
        Long customerId,
        Long driverId,
        OrderStatus status,
        Double latitude,
        Double longitude,
        String address,
        LocalDateTime submittedAt
) {
}
