package com.driftpool.trip.payment;

import java.math.BigDecimal;

/**
 * External payment processor. Every call is network-fallible and is retried by
 * {@link PaymentOrchestrator}, never by the gateway itself. The idempotency key lets the
 * processor collapse a retried call onto the original attempt.
 */
public interface PaymentGateway {

    /** Places a hold for {@code amount} on the customer's payment method. */
    GatewayResult authorize(String customerId, BigDecimal amount, String currency, String idempotencyKey);

    /** Captures a previously authorized hold in full. */
    GatewayResult capture(String reference, String idempotencyKey);

    /** Charges the customer's payment method immediately. */
    GatewayResult charge(String customerId, BigDecimal amount, String currency, String idempotencyKey);

    /** Refunds {@code amount} of a captured payment. */
    GatewayResult refund(String reference, BigDecimal amount, String idempotencyKey);

    /** Releases an uncaptured hold. */
    GatewayResult release(String reference, String idempotencyKey);
}
