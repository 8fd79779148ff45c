package org.tripweave.planning.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Spot and SpotDefaults Tests")
class SpotTest {

    @Test
    @DisplayName("Category is trimmed and lower-cased; optional fields default to null")
    void testNormalization() {
        Spot spot = Spot.of("  Senso-ji ", 35.7148, 139.7967, " Temple ");
        assertEquals("Senso-ji", spot.name());
        assertEquals("temple", spot.category());
        assertNull(spot.durationMinutes());
        assertNull(spot.rating());
    }

    @Test
    @DisplayName("Identity is name plus coordinates")
    void testIdentity() {
        Spot a = Spot.builder().name("Ueno Park").lat(35.71).lon(139.77).category("park").rating(4.0).build();
        Spot sameIdentity = Spot.of("Ueno Park", 35.71, 139.77, "outdoor");
        Spot moved = Spot.of("Ueno Park", 35.72, 139.77, "park");
        Spot renamed = Spot.of("Ueno Zoo", 35.71, 139.77, "park");

        assertEquals(a, sameIdentity);
        assertEquals(a.hashCode(), sameIdentity.hashCode());
        assertNotEquals(a, moved);
        assertNotEquals(a, renamed);
    }

    @Test
    @DisplayName("Invalid fields are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> Spot.of(" ", 0.0, 0.0, "park"));
        assertThrows(NullPointerException.class, () -> Spot.of(null, 0.0, 0.0, "park"));
        assertThrows(IllegalArgumentException.class, () -> Spot.of("X", 90.5, 0.0, "park"));
        assertThrows(IllegalArgumentException.class, () -> Spot.of("X", 0.0, -180.5, "park"));
        assertThrows(IllegalArgumentException.class, () -> Spot.of("X", Double.NaN, 0.0, "park"));
        assertThrows(IllegalArgumentException.class, () -> Spot.of("X", 0.0, 0.0, ""));
        assertThrows(IllegalArgumentException.class,
                () -> Spot.builder().name("X").lat(0.0).lon(0.0).category("park").durationMinutes(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> Spot.builder().name("X").lat(0.0).lon(0.0).category("park").rating(5.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> Spot.builder().name("X").lat(0.0).lon(0.0).category("park").rating(0.5).build());
    }

    @Test
    @DisplayName("Boundary coordinates and ratings are accepted")
    void testBoundaries() {
        Spot pole = Spot.builder().name("Pole").lat(90.0).lon(-180.0).category("outdoor").rating(1.0).build();
        assertEquals(90.0, pole.lat());
        Spot top = Spot.builder().name("Top").lat(-90.0).lon(180.0).category("outdoor").rating(5.0).build();
        assertEquals(5.0, top.rating());
    }

    @Test
    @DisplayName("Category defaults fill only missing duration and rating")
    void testDefaults() {
        Spot museum = Spot.of("Museum", 35.0, 139.0, "museum");
        Spot filled = SpotDefaults.withDefaults(museum);
        assertEquals(90, filled.durationMinutes());
        assertEquals(4.5, filled.rating());
        assertEquals(museum, filled);

        Spot rated = Spot.builder().name("Food").lat(35.0).lon(139.0).category("food").rating(3.2).build();
        Spot partial = SpotDefaults.withDefaults(rated);
        assertEquals(60, partial.durationMinutes());
        assertEquals(3.2, partial.rating());

        Spot unknown = Spot.of("Bridge", 35.0, 139.0, "sightseeing");
        assertSame(unknown, SpotDefaults.withDefaults(unknown));
    }
}
