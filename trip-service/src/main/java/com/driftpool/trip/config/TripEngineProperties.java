package com.driftpool.trip.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "driftpool")
public class TripEngineProperties {

    /** Local time zone the pricing bands are defined in. */
    private String timeZone = "America/Cayman";

    /** ISO-4217 code used for gateway calls (Cayman Islands dollar). */
    private String currency = "KYD";

    private String zonesResource = "pricing/zones.json";

    private Matching matching = new Matching();
    private Lifecycle lifecycle = new Lifecycle();
    private Reaper reaper = new Reaper();
    private Payment payment = new Payment();
    private BlockList blockList = new BlockList();

    @Data
    public static class Matching {
        private double defaultRadiusKm = 10.0;
        private double maxRadiusKm = 50.0;
        /** Unaccepted requests older than this are hidden from drivers. */
        private Duration stalenessWindow = Duration.ofMinutes(5);
        /** Re-evaluation tick so requests age out without an upstream change. */
        private Duration refreshInterval = Duration.ofSeconds(15);
        private double averageSpeedKmh = 30.0;
        private int openRequestLimit = 50;
    }

    @Data
    public static class Lifecycle {
        private Duration tipWindow = Duration.ofDays(3);
        private int maxRoutePoints = 500;
        private long tipCheckMs = 300_000;
    }

    @Data
    public static class Reaper {
        /** REQUESTED trips older than this are expired. */
        private Duration maxAge = Duration.ofMinutes(30);
        private long initialDelayMs = 60_000;
        private long intervalMs = 60_000;
    }

    @Data
    public static class Payment {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        /** Simulated gateway only: probability of a transient failure per call. */
        private double simulatedFailureRate = 0.0;
        private long reconciliationIntervalMs = 300_000;
        /** A claimed gateway call older than this is treated as abandoned and flagged. */
        private Duration claimTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class BlockList {
        private Duration cacheTtl = Duration.ofSeconds(60);
    }
}
