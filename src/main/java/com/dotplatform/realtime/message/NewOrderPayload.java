package com.dotplatform.realtime.message;

import com.dotplatform.order.entity.OrderType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewOrderPayload(Long orderId, OrderType orderType, LocalDateTime timestamp) {
}
