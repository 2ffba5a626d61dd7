package com.dotplatform.realtime.message;

import com.dotplatform.order.entity.OrderStatus;
import com.dotplatform.order.event.RecipientLocationSubmittedEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

/**
 * {@code order_update} sent when the recipient of a delivery sets the drop-off point.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DropoffUpdatePayload(
        Long orderId,
        OrderStatus status,
        Double dropoffLatitude,
        Double dropoffLongitude,
        String dropoffAddress,
        LocalDateTime timestamp
) {
    public static DropoffUpdatePayload from(RecipientLocationSubmittedEvent event) {
        return new DropoffUpdatePayload(event.orderId(), event.status(), event.latitude(),
                event.longitude(), event.address(), event.submittedAt());
    }
}
