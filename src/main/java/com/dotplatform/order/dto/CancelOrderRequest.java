package com.dotplatform.order.dto;

import jakarta.validation.constraints.Size;

public record CancelOrderRequest(@Size(max = 1000) String reason) {
}
