package com.driftpool.trip.payment;

/**
 * Gateway call failure. Transient failures (timeouts, 5xx, rate limits) are retryable;
 * hard declines and unknown references are not.
 */
public class PaymentGatewayException extends RuntimeException {

    private final String code;
    private final boolean retryable;

    public PaymentGatewayException(String code, String message, boolean retryable) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }

    public PaymentGatewayException(String code, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }

    public static PaymentGatewayException transientFailure(String code, String message) {
        return new PaymentGatewayException(code, message, true);
    }

    public static PaymentGatewayException rejected(String code, String message) {
        return new PaymentGatewayException(code, message, false);
    }

    /** Anything the gateway client threw that is not a gateway failure; never retried. */
    public static PaymentGatewayException unexpected(RuntimeException cause) {
        return new PaymentGatewayException("GATEWAY_ERROR", String.valueOf(cause.getMessage()), false, cause);
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
