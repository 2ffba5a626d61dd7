package com.dotplatform.realtime.message;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DriverLocationPayload(Long driverId, double latitude, double longitude, LocalDateTime timestamp) {
}
