package org.tripweave.planning.semantics;

import lombok.experimental.UtilityClass;
import org.tripweave.planning.model.Spot;

import java.util.Set;

/**
 * Indoor/outdoor classification by spot category.
 *
 * <p>The two category sets are disjoint. Categories outside both (food, history,
 * sightseeing, anything unknown) classify as {@link Exposure#NEITHER}.</p>
 */
@UtilityClass
public final class SpotClassifier {
    public static final Set<String> OUTDOOR_CATEGORIES = Set.of("outdoor", "beach", "park", "garden");
    public static final Set<String> INDOOR_CATEGORIES = Set.of("indoor", "museum", "shopping", "temple");

    /**
     * Weather exposure of a spot.
     */
    public enum Exposure {
        INDOOR,
        OUTDOOR,
        NEITHER
    }

    public static boolean isOutdoor(Spot spot) {
        return spot != null && OUTDOOR_CATEGORIES.contains(spot.category());
    }

    public static boolean isIndoor(Spot spot) {
        return spot != null && INDOOR_CATEGORIES.contains(spot.category());
    }

    public static Exposure exposure(Spot spot) {
        if (isOutdoor(spot)) {
            return Exposure.OUTDOOR;
        }
        if (isIndoor(spot)) {
            return Exposure.INDOOR;
        }
        return Exposure.NEITHER;
    }
}
