package com.dotplatform.admin.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

// amount rules (positive, 2 decimals) live in WalletService
public record TopUpRequest(@NotNull Long driverId, @NotNull BigDecimal amount) {
}
