package com.dotplatform.realtime.registry;

import java.time.LocalDateTime;

public record DriverLocation(double latitude, double longitude, LocalDateTime timestamp) {
}
