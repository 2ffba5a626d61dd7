package com.dotplatform.order.dto;

import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.entity.OrderStatusLog;

import java.time.LocalDateTime;

public record OrderStatusLogResponse(
        Long id,
        Long orderId,
        OrderStatus oldStatus,
        OrderStatus newStatus,
        Long changedBy,
        LocalDateTime timestamp,
        String notes
) {
    public static OrderStatusLogResponse from(OrderStatusLog log) {
        return new OrderStatusLogResponse(log.getId(), log.getOrderId(), log.getOldStatus(),
                log.getNewStatus(), log.getChangedBy(), log.getChangedAt(), log.getNotes());
    }
}
