package com.dotplatform.rating.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * The score range is checked by {@code RatingService} so that out-of-range values surface as
 * INVALID_INPUT with a specific message.
 */
public record CreateRatingRequest(
        @NotNull Long orderId,
        @NotNull Integer score,
        @Size(max = 1000) String comment
) {
}
