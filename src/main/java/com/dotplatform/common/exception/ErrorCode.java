package com.dotplatform.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    CONFLICT(HttpStatus.CONFLICT, "Concurrent modification, please retry"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),

    // Identity
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    NOT_AUTHORIZED(HttpStatus.FORBIDDEN, "Not authorized for this operation"),

    // Order
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    ORDER_NOT_AVAILABLE(HttpStatus.CONFLICT, "Order is no longer available"),
    INVALID_TRANSITION(HttpStatus.BAD_REQUEST, "Invalid order status transition"),
    LOCATION_TOKEN_NOT_FOUND(HttpStatus.NOT_FOUND, "Invalid or expired location link"),
    LOCATION_TOKEN_USED(HttpStatus.CONFLICT, "Location has already been submitted"),

    // Wallet
    INSUFFICIENT_BALANCE(HttpStatus.FORBIDDEN, "Insufficient wallet balance"),
    DEDUCTION_NOT_FOUND(HttpStatus.NOT_FOUND, "No commission deduction for this order"),
    ALREADY_REFUNDED(HttpStatus.CONFLICT, "Commission already refunded"),

    // Pricing
    PRICING_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Could not calculate route distance"),

    // Rating
    ALREADY_RATED(HttpStatus.CONFLICT, "Order already rated");

    private final HttpStatus status;
    private final String message;
}
