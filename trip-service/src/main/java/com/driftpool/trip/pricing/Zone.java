package com.driftpool.trip.pricing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * A named pricing polygon. {@code boundary} is a closed ring of {@code [longitude, latitude]} pairs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Zone {

    private String id;
    private String name;
    private String displayName;
    private boolean airport;
    private int priority;
    private BigDecimal flatRate;
    private BigDecimal airportContribution;
    private List<double[]> boundary;

    /**
     * Ray-casting point-in-polygon: counts crossings of a ray cast east from the point.
     */
    public boolean contains(double latitude, double longitude) {
        if (boundary == null || boundary.size() < 3) {
            return false;
        }
        boolean inside = false;
        for (int i = 0, j = boundary.size() - 1; i < boundary.size(); j = i++) {
            double xi = boundary.get(i)[0], yi = boundary.get(i)[1];
            double xj = boundary.get(j)[0], yj = boundary.get(j)[1];
            boolean crosses = (yi > latitude) != (yj > latitude)
                    && longitude < (xj - xi) * (latitude - yi) / (yj - yi) + xi;
            if (crosses) {
                inside = !inside;
            }
        }
        return inside;
    }
}
