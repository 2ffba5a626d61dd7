package com.dotplatform.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Default gateway used until a real SMS provider is wired in: renders the message and writes
 * it to the log.
 */
@Slf4j
@Component
public class LoggingSmsSender implements SmsSender {

    private final String linkBaseUrl;

    public LoggingSmsSender(
            @Value("${dot.sms.location-link-base-url:https://dot-app.com/set-location}") String linkBaseUrl) {
        this.linkBaseUrl = linkBaseUrl.endsWith("/") ? linkBaseUrl.substring(0, linkBaseUrl.length() - 1) : linkBaseUrl;
    }

    @Override
    public boolean sendLocationLink(String phoneNumber, String locationToken, Long orderId) {
        String message = locationLinkMessage(orderId, locationToken);
        log.info("SMS to {}: {}", mask(phoneNumber), message);
        return true;
    }

    String locationLinkMessage(Long orderId, String locationToken) {
        return "DOT Delivery: Please set your location for order #" + orderId + ": "
                + linkBaseUrl + "/" + locationToken;
    }

    private static String mask(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.length() <= 4) {
            return "****";
        }
        return "*".repeat(phoneNumber.length() - 4) + phoneNumber.substring(phoneNumber.length() - 4);
    }
}
