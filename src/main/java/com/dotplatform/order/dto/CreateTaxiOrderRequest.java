package com.dotplatform.order.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateTaxiOrderRequest(
        @NotNull @DecimalMin("-90") @DecimalMax("90") Double pickupLatitude,
        @NotNull @DecimalMin("-180") @DecimalMax("180") Double pickupLongitude,
        @Size(max = 255) String pickupAddress,
        @NotNull @DecimalMin("-90") @DecimalMax("90") Double dropoffLatitude,
        @NotNull @DecimalMin("-180") @DecimalMax("180") Double dropoffLongitude,
        @Size(max = 255) String dropoffAddress
) {
}
