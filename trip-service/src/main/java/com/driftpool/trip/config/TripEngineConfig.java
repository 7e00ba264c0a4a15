package com.driftpool.trip.config;

import com.driftpool.trip.payment.BoundedRetry;
import com.driftpool.trip.pricing.ZoneCatalog;
import com.driftpool.trip.pricing.ZonePricingEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TripEngineProperties.class)
public class TripEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneCatalog zoneCatalog(ObjectMapper objectMapper, TripEngineProperties properties) {
        return ZoneCatalog.fromClasspath(objectMapper, properties.getZonesResource());
    }

    @Bean
    public ZonePricingEngine zonePricingEngine(ZoneCatalog zoneCatalog) {
        return new ZonePricingEngine(zoneCatalog);
    }

    @Bean
    public BoundedRetry paymentRetry(TripEngineProperties properties) {
        TripEngineProperties.Payment payment = properties.getPayment();
        return new BoundedRetry(payment.getMaxAttempts(),
                IntervalFunction.ofExponentialBackoff(payment.getInitialBackoff().toMillis(), payment.getBackoffMultiplier()));
    }
}
