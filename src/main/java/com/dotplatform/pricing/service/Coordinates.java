package com.dotplatform.pricing.service;

public record Coordinates(double latitude, double longitude) {

    public String toQueryParam() {
        return latitude + "," + longitude;
    }
}
