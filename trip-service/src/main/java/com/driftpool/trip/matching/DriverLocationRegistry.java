package com.driftpool.trip.matching;

import com.driftpool.trip.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest known position per driver, exposed as a stream that replays the last fix to new
 * subscribers. Fed by the driver app's location pings.
 */
@Slf4j
@Component
public class DriverLocationRegistry {

    private final Map<String, Sinks.Many<GeoPoint>> locations = new ConcurrentHashMap<>();
    private final Map<String, GeoPoint> latest = new ConcurrentHashMap<>();

    public synchronized void update(String driverId, GeoPoint location) {
        latest.put(driverId, location);
        Sinks.EmitResult result = sink(driverId).tryEmitNext(location);
        if (result.isFailure()) {
            log.debug("Location for driver {} not emitted: {}", driverId, result);
        }
    }

    public Flux<GeoPoint> locations(String driverId) {
        return sink(driverId).asFlux();
    }

    public Optional<GeoPoint> latest(String driverId) {
        return Optional.ofNullable(latest.get(driverId));
    }

    private Sinks.Many<GeoPoint> sink(String driverId) {
        return locations.computeIfAbsent(driverId, id -> Sinks.many().replay().latest());
    }
}
