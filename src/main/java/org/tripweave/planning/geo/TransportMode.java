package org.tripweave.planning.geo;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Locale;

/**
 * Supported travel modes between consecutive spots.
 *
 * <p>Each mode has a fixed average speed and a fixed per-leg overhead. {@code TRANSIT}
 * carries five minutes of overhead for waiting at the stop; walking and taxi legs
 * start immediately.</p>
 */
@Getter
@Accessors(fluent = true)
public enum TransportMode {
    WALK(5.0d, 0.0d),
    TRANSIT(25.0d, 5.0d),
    TAXI(30.0d, 0.0d);

    private static final double MINUTES_PER_HOUR = 60.0d;

    private final double speedKmh;
    private final double overheadMinutes;

    TransportMode(double speedKmh, double overheadMinutes) {
        this.speedKmh = speedKmh;
        this.overheadMinutes = overheadMinutes;
    }

    /**
     * Converts a leg distance into travel minutes including the fixed overhead.
     */
    public double travelMinutes(double distanceKm) {
        return distanceKm / speedKmh * MINUTES_PER_HOUR + overheadMinutes;
    }

    /**
     * Parses a user-facing preference ({@code walk}, {@code transit}, {@code taxi}).
     *
     * @throws IllegalArgumentException when the value names no mode.
     */
    public static TransportMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("transport mode must be non-blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TransportMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
                "unknown transport mode '" + value + "', expected one of walk, transit, taxi"
        );
    }
}
