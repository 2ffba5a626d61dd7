package com.dotplatform.admin.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RefundRequest(@NotNull Long orderId, @Size(max = 500) String reason) {
}
