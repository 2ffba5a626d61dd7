package com.dotplatform.realtime.message;

import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.entity.OrderType;
import com.dotplatform.order.event.OrderStatusChangedEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderUpdatePayload(
        Long orderId,
        OrderType orderType,
        OrderStatus status,
        OrderStatus previousStatus,
        LocalDateTime timestamp
) {
    public static OrderUpdatePayload from(OrderStatusChangedEvent event) {
        return new OrderUpdatePayload(event.orderId(), event.orderType(), event.status(),
                event.previousStatus(), event.occurredAt());
    }
}
