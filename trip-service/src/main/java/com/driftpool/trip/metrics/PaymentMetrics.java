package com.driftpool.trip.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Gateway outcome counters tagged by operation (authorize, capture, charge, refund, release, tip).
 *
 *   payment_operations_total{operation, outcome="success|exhausted"}
 *   payment_attempts_total{operation}
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSuccess(String operation, int attempts) {
        outcome(operation, "success").increment();
        attempts(operation).increment(attempts);
    }

    public void recordExhausted(String operation, int attempts) {
        outcome(operation, "exhausted").increment();
        attempts(operation).increment(attempts);
    }

    private Counter outcome(String operation, String outcome) {
        return Counter.builder("payment.operations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .description("Payment gateway operations by final outcome")
                .register(registry);
    }

    private Counter attempts(String operation) {
        return Counter.builder("payment.attempts")
                .tag("operation", operation)
                .description("Individual gateway call attempts, retries included")
                .register(registry);
    }
}
