package com.driftpool.trip.payment;

import com.driftpool.trip.config.TripEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * In-process stand-in for the card processor (manual-capture PaymentIntents in production).
 *
 * Keeps hold state per reference so capture/release/refund behave like the real thing, replays
 * the stored result for a repeated idempotency key, and fails transiently at the configured rate
 * to exercise the orchestrator's retry path.
 */
@Slf4j
@Component
public class SimulatedPaymentGateway implements PaymentGateway {

    private enum HoldState { AUTHORIZED, CAPTURED, RELEASED, REFUNDED }

    private final double failureRate;
    private final Map<String, HoldState> holds = new ConcurrentHashMap<>();
    private final Map<String, GatewayResult> replies = new ConcurrentHashMap<>();

    public SimulatedPaymentGateway(TripEngineProperties properties) {
        this.failureRate = properties.getPayment().getSimulatedFailureRate();
    }

    @Override
    public GatewayResult authorize(String customerId, BigDecimal amount, String currency, String idempotencyKey) {
        return replayOr(idempotencyKey, () -> {
            log.info("Gateway authorize: customer={} amount={} {}", customerId, amount, currency);
            String reference = newReference("pi");
            holds.put(reference, HoldState.AUTHORIZED);
            return new GatewayResult(reference, "requires_capture");
        });
    }

    @Override
    public GatewayResult capture(String reference, String idempotencyKey) {
        return replayOr(idempotencyKey, () -> {
            log.info("Gateway capture: ref={}", reference);
            HoldState state = holdState(reference);
            if (state == HoldState.CAPTURED) {
                return new GatewayResult(reference, "already_captured");
            }
            if (state != HoldState.AUTHORIZED) {
                throw PaymentGatewayException.rejected("INVALID_HOLD_STATE", "Cannot capture " + reference + " in state " + state);
            }
            holds.put(reference, HoldState.CAPTURED);
            return new GatewayResult(reference, "succeeded");
        });
    }

    @Override
    public GatewayResult charge(String customerId, BigDecimal amount, String currency, String idempotencyKey) {
        return replayOr(idempotencyKey, () -> {
            log.info("Gateway charge: customer={} amount={} {}", customerId, amount, currency);
            String reference = newReference("ch");
            holds.put(reference, HoldState.CAPTURED);
            return new GatewayResult(reference, "succeeded");
        });
    }

    @Override
    public GatewayResult refund(String reference, BigDecimal amount, String idempotencyKey) {
        return replayOr(idempotencyKey, () -> {
            log.info("Gateway refund: ref={} amount={}", reference, amount);
            if (holdState(reference) != HoldState.CAPTURED) {
                throw PaymentGatewayException.rejected("NOT_CAPTURED", "Cannot refund uncaptured payment " + reference);
            }
            holds.put(reference, HoldState.REFUNDED);
            return new GatewayResult(newReference("re"), "succeeded");
        });
    }

    @Override
    public GatewayResult release(String reference, String idempotencyKey) {
        return replayOr(idempotencyKey, () -> {
            log.info("Gateway release: ref={}", reference);
            HoldState state = holdState(reference);
            if (state == HoldState.RELEASED) {
                return new GatewayResult(reference, "already_canceled");
            }
            if (state != HoldState.AUTHORIZED) {
                throw PaymentGatewayException.rejected("INVALID_HOLD_STATE", "Cannot release " + reference + " in state " + state);
            }
            holds.put(reference, HoldState.RELEASED);
            return new GatewayResult(reference, "canceled");
        });
    }

    private GatewayResult replayOr(String idempotencyKey, Supplier<GatewayResult> call) {
        GatewayResult previous = replies.get(idempotencyKey);
        if (previous != null) {
            log.debug("Gateway replay for idempotency key {}", idempotencyKey);
            return previous;
        }
        if (ThreadLocalRandom.current().nextDouble() < failureRate) {
            throw PaymentGatewayException.transientFailure("GATEWAY_TIMEOUT", "Payment gateway timeout");
        }
        GatewayResult result = call.get();
        replies.put(idempotencyKey, result);
        return result;
    }

    private HoldState holdState(String reference) {
        HoldState state = holds.get(reference);
        if (state == null) {
            throw PaymentGatewayException.rejected("NO_SUCH_PAYMENT", "Unknown payment reference " + reference);
        }
        return state;
    }

    private static String newReference(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
