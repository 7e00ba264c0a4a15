package com.driftpool.trip.payment;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs a gateway call up to {@code maxAttempts} times, waiting {@code backoff(n)} between attempts
 * (1s, 2s, 4s... with the default exponential function). Retryable gateway failures are retried;
 * non-retryable ones, and any other runtime exception from the client, end the loop at once.
 * The outcome is returned, never thrown.
 */
@Slf4j
public class BoundedRetry {

    private final int maxAttempts;
    private final IntervalFunction backoff;

    public BoundedRetry(int maxAttempts, IntervalFunction backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    public <T> RetryOutcome<T> execute(String operation, Supplier<T> call) {
        AtomicInteger attempts = new AtomicInteger();

        Retry retry = Retry.of(operation, RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff)
                .retryOnException(BoundedRetry::isRetryable)
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn("{} attempt {} failed, retrying in {}ms: {}",
                operation, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        Supplier<T> guarded = Retry.decorateSupplier(retry, () -> {
            attempts.incrementAndGet();
            return call.get();
        });

        try {
            return RetryOutcome.success(guarded.get(), attempts.get());
        } catch (PaymentGatewayException e) {
            log.error("{} gave up after {} attempt(s): {} {}", operation, attempts.get(), e.getCode(), e.getMessage());
            return RetryOutcome.exhausted(e, attempts.get());
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly after {} attempt(s)", operation, attempts.get(), e);
            return RetryOutcome.exhausted(PaymentGatewayException.unexpected(e), attempts.get());
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static boolean isRetryable(Throwable t) {
        return t instanceof PaymentGatewayException && ((PaymentGatewayException) t).isRetryable();
    }
}
