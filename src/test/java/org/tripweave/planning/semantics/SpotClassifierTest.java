package org.tripweave.planning.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tripweave.planning.model.Spot;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SpotClassifier Tests")
class SpotClassifierTest {

    private static Spot of(String category) {
        return Spot.of("X", 35.0, 139.0, category);
    }

    @Test
    @DisplayName("Outdoor and indoor categories classify as expected")
    void testKnownCategories() {
        for (String category : new String[]{"outdoor", "beach", "park", "garden"}) {
            assertTrue(SpotClassifier.isOutdoor(of(category)), category);
            assertFalse(SpotClassifier.isIndoor(of(category)), category);
            assertEquals(SpotClassifier.Exposure.OUTDOOR, SpotClassifier.exposure(of(category)));
        }
        for (String category : new String[]{"indoor", "museum", "shopping", "temple"}) {
            assertTrue(SpotClassifier.isIndoor(of(category)), category);
            assertFalse(SpotClassifier.isOutdoor(of(category)), category);
            assertEquals(SpotClassifier.Exposure.INDOOR, SpotClassifier.exposure(of(category)));
        }
    }

    @Test
    @DisplayName("Unknown categories and null spots are neither, without failing")
    void testUnknownCategories() {
        for (String category : new String[]{"food", "history", "sightseeing", "nightlife"}) {
            assertFalse(SpotClassifier.isOutdoor(of(category)));
            assertFalse(SpotClassifier.isIndoor(of(category)));
            assertEquals(SpotClassifier.Exposure.NEITHER, SpotClassifier.exposure(of(category)));
        }
        assertFalse(SpotClassifier.isOutdoor(null));
        assertFalse(SpotClassifier.isIndoor(null));
    }

    @Test
    @DisplayName("Category sets are disjoint and casing does not matter")
    void testDisjointAndCaseInsensitive() {
        Set<String> overlap = new HashSet<>(SpotClassifier.OUTDOOR_CATEGORIES);
        overlap.retainAll(SpotClassifier.INDOOR_CATEGORIES);
        assertTrue(overlap.isEmpty());
        assertTrue(SpotClassifier.isIndoor(of("MUSEUM")));
    }
}
