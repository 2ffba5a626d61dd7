package com.dotplatform.pricing.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * Google Maps web services: Distance Matrix and reverse Geocoding.
 *
 * Timeouts come from {@code FeignConfig}; circuit breaking and retries are applied by
 * {@code MapsService}, never by callers.
 */
@FeignClient(name = "google-maps", url = "${dot.maps.base-url:https://maps.googleapis.com/maps/api}")
public interface GoogleMapsClient {

    @GetMapping("/distancematrix/json")
    DistanceMatrixResponse getDistanceMatrix(@RequestParam("origins") String origins,
                                             @RequestParam("destinations") String destinations,
                                             @RequestParam("mode") String mode,
                                             @RequestParam("key") String apiKey);

    @GetMapping("/geocode/json")
    GeocodeResponse reverseGeocode(@RequestParam("latlng") String latlng,
                                   @RequestParam("key") String apiKey);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DistanceMatrixResponse(String status, List<Row> rows) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Row(List<Element> elements) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Element(String status, Distance distance) {}

        // value in meters
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Distance(long value, String text) {}
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeocodeResponse(String status, List<Result> results) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Result(@JsonProperty("formatted_address") String formattedAddress) {}
    }
}
