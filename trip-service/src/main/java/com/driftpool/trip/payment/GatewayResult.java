package com.driftpool.trip.payment;

/**
 * Gateway acknowledgement: the payment (or refund) reference and the gateway-side status.
 */
public record GatewayResult(String reference, String status) {
}
