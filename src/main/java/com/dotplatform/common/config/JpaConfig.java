package com.dotplatform.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.Clock;

/**
 * JPA auditing fills {@code @CreatedDate} / {@code @LastModifiedDate} on persist and update.
 * The {@link Clock} bean is the single source of server time for status timestamps and audit
 * entries, so that callers can never supply their own.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
