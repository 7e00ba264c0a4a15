package com.driftpool.trip.pricing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, priority-ordered set of pricing zones.
 *
 * Zones may overlap (the island-wide fallback covers everything), so lookups walk the list in
 * priority order and the first match wins: airport, then the named districts, then the fallback.
 * Every point therefore resolves to exactly one zone or none.
 */
public class ZoneCatalog {

    private final List<Zone> zones;

    public ZoneCatalog(List<Zone> zones) {
        this.zones = zones.stream()
                .sorted(Comparator.comparingInt(Zone::getPriority))
                .toList();
    }

    public static ZoneCatalog fromClasspath(ObjectMapper objectMapper, String resource) {
        try (InputStream in = ZoneCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Zone definition " + resource + " not found on classpath");
            }
            return new ZoneCatalog(objectMapper.readValue(in, new TypeReference<List<Zone>>() {}));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load zone definition " + resource, e);
        }
    }

    public Optional<Zone> resolve(double latitude, double longitude) {
        return zones.stream()
                .filter(z -> z.contains(latitude, longitude))
                .findFirst();
    }
}
