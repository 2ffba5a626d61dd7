package com.dotplatform.pricing.service;

import com.dotplatform.pricing.client.GoogleMapsClient;
import com.dotplatform.pricing.client.GoogleMapsClient.DistanceMatrixResponse;
import com.dotplatform.pricing.client.GoogleMapsClient.GeocodeResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Distance and address lookups against the maps provider.
 *
 * <p>Both calls are protected by the {@code maps} circuit breaker and retry instances. A failing
 * or unconfigured provider yields {@link Optional#empty()}; the caller decides whether that is
 * fatal (pricing) or not (address enrichment).</p>
 */
@Slf4j
@Service
public class MapsService {

    private static final String STATUS_OK = "OK";

    private final GoogleMapsClient mapsClient;
    private final String apiKey;

    public MapsService(GoogleMapsClient mapsClient,
                       @Value("${dot.maps.api-key:}") String apiKey) {
        this.mapsClient = mapsClient;
        this.apiKey = apiKey;
    }

    /**
     * Driving distance in kilometers.
     */
    @CircuitBreaker(name = "maps", fallbackMethod = "distanceFallback")
    @Retry(name = "maps")
    public Optional<BigDecimal> getDistanceKm(Coordinates origin, Coordinates destination) {
        if (apiKey.isBlank()) {
            log.warn("Maps API key not configured, distance unavailable");
            return Optional.empty();
        }

        DistanceMatrixResponse response = mapsClient.getDistanceMatrix(
                origin.toQueryParam(), destination.toQueryParam(), "driving", apiKey);
        if (response == null || !STATUS_OK.equals(response.status())
                || response.rows() == null || response.rows().isEmpty()
                || response.rows().get(0).elements() == null
                || response.rows().get(0).elements().isEmpty()) {
            log.warn("Distance matrix returned no route: status={}", response == null ? null : response.status());
            return Optional.empty();
        }

        DistanceMatrixResponse.Element element = response.rows().get(0).elements().get(0);
        if (!STATUS_OK.equals(element.status()) || element.distance() == null) {
            log.warn("Distance matrix element not routable: status={}", element.status());
            return Optional.empty();
        }
        return Optional.of(BigDecimal.valueOf(element.distance().value())
                .divide(BigDecimal.valueOf(1000), 3, RoundingMode.HALF_UP));
    }

    @CircuitBreaker(name = "maps", fallbackMethod = "addressFallback")
    @Retry(name = "maps")
    public Optional<String> reverseGeocode(Coordinates point) {
        if (apiKey.isBlank()) {
            return Optional.empty();
        }

        GeocodeResponse response = mapsClient.reverseGeocode(point.toQueryParam(), apiKey);
        if (response == null || !STATUS_OK.equals(response.status())
                || response.results() == null || response.results().isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(response.results().get(0).formattedAddress());
    }

    private Optional<BigDecimal> distanceFallback(Coordinates origin, Coordinates destination, Throwable t) {
        log.warn("Distance lookup failed: {} -> {}, cause={}", origin, destination, t.toString());
        return Optional.empty();
    }

    private Optional<String> addressFallback(Coordinates point, Throwable t) {
        log.warn("Reverse geocode failed: {}, cause={}", point, t.toString());
        return Optional.empty();
    }
}
