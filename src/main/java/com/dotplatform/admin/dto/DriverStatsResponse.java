package com.dotplatform.admin.dto;

import java.math.BigDecimal;

public record DriverStatsResponse(
        Long driverId,
        long totalOrders,
        long completedOrders,
        long cancelledOrders,
        BigDecimal averageRating,
        BigDecimal walletBalance
) {
}
