package com.dotplatform.pricing.config;

import feign.Request;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Connect/read timeouts of the maps provider client.
 *
 * <pre>
 *   Feign: 3s connect + 5s read, per attempt
 *   Retry (maps): up to 2 attempts
 * </pre>
 *
 * Without them a hung provider would hold the request thread of an order creation open
 * indefinitely. Order creation calls the provider with no transaction open, so a slow call
 * holds neither a pooled connection nor a row lock.
 */
@Configuration
public class FeignConfig {

    @Bean
    public Request.Options feignRequestOptions(
            @Value("${dot.maps.connect-timeout-ms:3000}") long connectTimeoutMs,
            @Value("${dot.maps.read-timeout-ms:5000}") long readTimeoutMs) {
        return new Request.Options(
                connectTimeoutMs, TimeUnit.MILLISECONDS,
                readTimeoutMs, TimeUnit.MILLISECONDS,
                true
        );
    }
}
