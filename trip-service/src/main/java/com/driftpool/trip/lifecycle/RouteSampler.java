package com.driftpool.trip.lifecycle;

import com.driftpool.trip.config.TripEngineProperties;
import com.driftpool.trip.model.GeoPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Thins a recorded route to at most {@code maxRoutePoints} evenly spaced points, always keeping the
 * first and last, and serializes it for the trip's {@code route_traveled} column.
 */
@Component
public class RouteSampler {

    private final ObjectMapper objectMapper;
    private final int maxPoints;

    public RouteSampler(ObjectMapper objectMapper, TripEngineProperties properties) {
        this.objectMapper = objectMapper;
        this.maxPoints = Math.max(2, properties.getLifecycle().getMaxRoutePoints());
    }

    public List<GeoPoint> downsample(List<GeoPoint> route) {
        if (route == null || route.isEmpty()) {
            return List.of();
        }
        if (route.size() <= maxPoints) {
            return List.copyOf(route);
        }
        List<GeoPoint> sampled = new ArrayList<>(maxPoints);
        double step = (double) (route.size() - 1) / (maxPoints - 1);
        for (int i = 0; i < maxPoints - 1; i++) {
            sampled.add(route.get((int) Math.round(i * step)));
        }
        sampled.add(route.get(route.size() - 1));
        return sampled;
    }

    public String toJson(List<GeoPoint> route) {
        try {
            return objectMapper.writeValueAsString(downsample(route));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Route serialisation failed", e);
        }
    }
}
