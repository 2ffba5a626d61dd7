package com.dotplatform.wallet.dto;

import java.math.BigDecimal;

public record EligibilityResponse(boolean canAcceptOrders, BigDecimal balance, BigDecimal requiredBalance) {
}
