package com.driftpool.trip.payment;

/**
 * Result of a bounded retry: either a value, or the last failure once attempts ran out.
 */
public final class RetryOutcome<T> {

    private final T value;
    private final PaymentGatewayException failure;
    private final int attempts;

    private RetryOutcome(T value, PaymentGatewayException failure, int attempts) {
        this.value = value;
        this.failure = failure;
        this.attempts = attempts;
    }

    public static <T> RetryOutcome<T> success(T value, int attempts) {
        return new RetryOutcome<>(value, null, attempts);
    }

    public static <T> RetryOutcome<T> exhausted(PaymentGatewayException failure, int attempts) {
        return new RetryOutcome<>(null, failure, attempts);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isExhausted() {
        return failure != null;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("No value: call failed after " + attempts + " attempt(s)", failure);
        }
        return value;
    }

    public PaymentGatewayException getFailure() {
        return failure;
    }

    public int getAttempts() {
        return attempts;
    }

    public String failureReason() {
        return failure == null ? null : failure.getCode() + ": " + failure.getMessage();
    }
}
