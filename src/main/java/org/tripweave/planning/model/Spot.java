package org.tripweave.planning.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable point of interest.
 *
 * <p>Identity is name plus coordinates; category, duration and rating do not take
 * part in equality. Category text is normalized to trimmed lower-case so that
 * classification is insensitive to source casing.</p>
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Spot {
    private static final double MIN_LAT = -90.0d;
    private static final double MAX_LAT = 90.0d;
    private static final double MIN_LON = -180.0d;
    private static final double MAX_LON = 180.0d;
    private static final double MIN_RATING = 1.0d;
    private static final double MAX_RATING = 5.0d;

    @EqualsAndHashCode.Include
    private final String name;
    @EqualsAndHashCode.Include
    private final double lat;
    @EqualsAndHashCode.Include
    private final double lon;
    private final String category;
    /** Expected visit duration, or null when unknown. */
    private final Integer durationMinutes;
    /** Rating in {@code [1.0, 5.0]}, or null when unknown. */
    private final Double rating;

    @Builder(toBuilder = true)
    private Spot(String name, double lat, double lon, String category, Integer durationMinutes, Double rating) {
        this.name = requireNonBlank(name, "name");
        this.lat = requireRange(lat, MIN_LAT, MAX_LAT, "lat");
        this.lon = requireRange(lon, MIN_LON, MAX_LON, "lon");
        this.category = requireNonBlank(category, "category").toLowerCase(Locale.ROOT);
        if (durationMinutes != null && durationMinutes <= 0) {
            throw new IllegalArgumentException("durationMinutes must be > 0, got " + durationMinutes);
        }
        this.durationMinutes = durationMinutes;
        if (rating != null) {
            requireRange(rating, MIN_RATING, MAX_RATING, "rating");
        }
        this.rating = rating;
    }

    /**
     * Creates a spot without duration or rating.
     */
    public static Spot of(String name, double lat, double lon, String category) {
        return new Spot(name, lat, lon, category, null, null);
    }

    private static String requireNonBlank(String value, String fieldName) {
        String trimmed = Objects.requireNonNull(value, fieldName).trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return trimmed;
    }

    private static double requireRange(double value, double min, double max, String fieldName) {
        if (!Double.isFinite(value) || value < min || value > max) {
            throw new IllegalArgumentException(
                    fieldName + " out of range: " + value + " [" + min + ", " + max + "]"
            );
        }
        return value;
    }
}
