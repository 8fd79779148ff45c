package org.tripweave.planning.model;

import lombok.experimental.UtilityClass;

import java.util.Map;

/**
 * Per-category fallback visit duration and rating for catalogue entries that omit them.
 */
@UtilityClass
public final class SpotDefaults {
    private static final Map<String, Integer> DEFAULT_DURATION_MINUTES = Map.of(
            "outdoor", 60,
            "indoor", 90,
            "temple", 45,
            "shopping", 60,
            "museum", 90,
            "food", 60
    );

    private static final Map<String, Double> DEFAULT_RATINGS = Map.of(
            "outdoor", 4.2d,
            "indoor", 4.3d,
            "temple", 4.1d,
            "shopping", 3.9d,
            "museum", 4.5d,
            "food", 4.0d
    );

    /**
     * Default duration for a category, or null when the category has none.
     */
    public static Integer defaultDurationMinutes(String category) {
        return category == null ? null : DEFAULT_DURATION_MINUTES.get(category);
    }

    /**
     * Default rating for a category, or null when the category has none.
     */
    public static Double defaultRating(String category) {
        return category == null ? null : DEFAULT_RATINGS.get(category);
    }

    /**
     * Returns the spot with absent duration/rating filled from category defaults.
     *
     * <p>Values already present on the spot are never overwritten. The same instance is
     * returned when nothing changes.</p>
     */
    public static Spot withDefaults(Spot spot) {
        Integer defaultDuration = spot.durationMinutes() == null ? defaultDurationMinutes(spot.category()) : null;
        Double defaultRating = spot.rating() == null ? defaultRating(spot.category()) : null;
        if (defaultDuration == null && defaultRating == null) {
            return spot;
        }
        Spot.SpotBuilder builder = spot.toBuilder();
        if (defaultDuration != null) {
            builder.durationMinutes(defaultDuration);
        }
        if (defaultRating != null) {
            builder.rating(defaultRating);
        }
        return builder.build();
    }
}
