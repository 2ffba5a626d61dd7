package com.dotplatform.order.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * The dropoff point is the sender's best guess; the recipient can correct it through the
 * location link sent by SMS.
 */
public record CreateDeliveryOrderRequest(
        @NotNull @DecimalMin("-90") @DecimalMax("90") Double pickupLatitude,
        @NotNull @DecimalMin("-180") @DecimalMax("180") Double pickupLongitude,
        @Size(max = 255) String pickupAddress,
        @NotNull @DecimalMin("-90") @DecimalMax("90") Double dropoffLatitude,
        @NotNull @DecimalMin("-180") @DecimalMax("180") Double dropoffLongitude,
        @Size(max = 255) String dropoffAddress,
        @NotBlank @Size(max = 100) String recipientName,
        @NotBlank @Pattern(regexp = "^\\+?[0-9 \\-]{6,20}$") String recipientPhone,
        @Size(max = 1000) String itemDescription,
        @PositiveOrZero BigDecimal itemPrice
) {
}
