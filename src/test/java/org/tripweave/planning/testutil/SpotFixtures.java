package org.tripweave.planning.testutil;

import org.tripweave.planning.model.DayPlan;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.model.Spot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Shared spot and itinerary fixtures for planning tests.
 */
public final class SpotFixtures {
    public static final double BASE_LAT = 35.68d;
    public static final double BASE_LON = 139.76d;

    private SpotFixtures() {
    }

    public static Spot spot(String name, double lat, double lon) {
        return Spot.of(name, lat, lon, "sightseeing");
    }

    public static Spot spot(String name, double lat, double lon, String category) {
        return Spot.of(name, lat, lon, category);
    }

    /**
     * Spots on an east-west line, {@code stepDegrees} apart, named {@code S0..S(n-1)}.
     */
    public static List<Spot> line(int count, double stepDegrees) {
        List<Spot> spots = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            spots.add(spot("S" + i, BASE_LAT, BASE_LON + i * stepDegrees));
        }
        return spots;
    }

    /**
     * Deterministic pseudo-random spots inside a box of {@code spanDegrees}.
     */
    public static List<Spot> scattered(int count, double spanDegrees, long seed) {
        Random random = new Random(seed);
        String[] categories = {"park", "museum", "food", "temple", "beach", "shopping", "history"};
        List<Spot> spots = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            spots.add(Spot.of(
                    "P" + i,
                    BASE_LAT + random.nextDouble() * spanDegrees,
                    BASE_LON + random.nextDouble() * spanDegrees,
                    categories[i % categories.length]
            ));
        }
        return spots;
    }

    /**
     * Builds an itinerary with the given routes as days 1..n.
     */
    @SafeVarargs
    public static Itinerary itinerary(List<Spot>... routes) {
        List<DayPlan> days = new ArrayList<>(routes.length);
        for (int i = 0; i < routes.length; i++) {
            days.add(new DayPlan(i + 1, routes[i]));
        }
        return new Itinerary("Testville", days);
    }

    /**
     * Asserts every expected spot appears exactly once across all days and nothing else does.
     */
    public static void assertPartition(List<Spot> expected, Itinerary itinerary) {
        assertEquals(counts(expected), counts(itinerary.allSpots()), "itinerary must partition the input spots");
    }

    /**
     * Day routes as spot-name lists, for compact equality checks.
     */
    public static List<List<String>> routeNames(Itinerary itinerary) {
        List<List<String>> names = new ArrayList<>();
        for (DayPlan day : itinerary.days()) {
            List<String> dayNames = new ArrayList<>();
            for (Spot spot : day.spots()) {
                dayNames.add(spot.name());
            }
            names.add(dayNames);
        }
        return names;
    }

    private static Map<Spot, Integer> counts(List<Spot> spots) {
        Map<Spot, Integer> counts = new HashMap<>();
        for (Spot spot : spots) {
            counts.merge(spot, 1, Integer::sum);
        }
        return counts;
    }
}
