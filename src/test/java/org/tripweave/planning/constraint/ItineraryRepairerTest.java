package org.tripweave.planning.constraint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tripweave.planning.geo.TransportMode;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.model.Spot;
import org.tripweave.planning.testutil.SpotFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ItineraryRepairer Tests")
class ItineraryRepairerTest {
    private final HardConstraintChecker checker = new HardConstraintChecker(HardConstraintLimits.defaults());
    private final ItineraryRepairer repairer = new ItineraryRepairer(checker);

    @Test
    @DisplayName("Last spot of a violating day moves to the nearest other day")
    void testRelocation() {
        Spot a = SpotFixtures.spot("A", 0.0, 0.0);
        Spot b = SpotFixtures.spot("B", 0.0, 0.05);
        Spot c = SpotFixtures.spot("C", 0.0, 0.1);
        Spot d = SpotFixtures.spot("D", 0.0, 0.2);
        Itinerary itinerary = SpotFixtures.itinerary(List.of(a, b, c), List.of(d));

        RepairReport report = repairer.repair(itinerary);

        assertEquals(1, report.getViolations().size());
        assertEquals(List.of(new RepairReport.Relocation(c, 1, 2)), report.getRelocations());
        assertTrue(report.isComplete());
        assertEquals(List.of(List.of("A", "B"), List.of("D", "C")), SpotFixtures.routeNames(itinerary));
        assertEquals(5.55d, itinerary.day(1).totalDistanceKm(), 1e-9);
        SpotFixtures.assertPartition(List.of(a, b, c, d), itinerary);
        assertTrue(checker.checkDailyDistance(itinerary).stream().noneMatch(v -> v.getDay() == 1));
    }

    @Test
    @DisplayName("Nearest destination is chosen by its last spot, first day wins ties")
    void testNearestDestination() {
        Spot a = SpotFixtures.spot("A", 0.0, 0.0);
        Spot b = SpotFixtures.spot("B", 0.0, 0.1);
        Spot far = SpotFixtures.spot("Far", 0.0, 0.5);
        Spot near = SpotFixtures.spot("Near", 0.0, 0.11);
        Spot twin = SpotFixtures.spot("Twin", 0.0, 0.11);
        Itinerary nearest = SpotFixtures.itinerary(List.of(a, b), List.of(far), List.of(near));
        repairer.repair(nearest);
        assertEquals(List.of("Near", "B"), SpotFixtures.routeNames(nearest).get(2));

        Itinerary tie = SpotFixtures.itinerary(List.of(a, b), List.of(near), List.of(twin));
        repairer.repair(tie);
        assertEquals(List.of("Near", "B"), SpotFixtures.routeNames(tie).get(1));
        assertEquals(List.of("Twin"), SpotFixtures.routeNames(tie).get(2));
    }

    @Test
    @DisplayName("Empty days are never chosen as destinations; with none left the spot is reported dropped")
    void testDroppedSpot() {
        Spot a = SpotFixtures.spot("A", 0.0, 0.0);
        Spot b = SpotFixtures.spot("B", 0.0, 0.1);
        Itinerary itinerary = SpotFixtures.itinerary(List.of(a, b), List.of());

        RepairReport report = repairer.repair(itinerary);

        assertFalse(report.isComplete());
        assertEquals(List.of(b), report.getDroppedSpots());
        assertTrue(report.getRelocations().isEmpty());
        assertEquals(List.of(List.of("A"), List.of()), SpotFixtures.routeNames(itinerary));
    }

    @Test
    @DisplayName("Single-spot days have no legs and are never touched, even with a zero ceiling")
    void testSingleSpotDaysUntouched() {
        ItineraryRepairer strict = new ItineraryRepairer(new HardConstraintChecker(
                HardConstraintLimits.builder().maxDailyKm(0.0d).build()
        ));
        Spot a = SpotFixtures.spot("A", 0.0, 0.0);
        Spot b = SpotFixtures.spot("B", 0.0, 0.01);
        Itinerary itinerary = SpotFixtures.itinerary(List.of(a), List.of(b));

        RepairReport report = strict.repair(itinerary);

        assertTrue(report.getViolations().isEmpty());
        assertTrue(report.getSkippedDays().isEmpty());
        assertTrue(report.getRelocations().isEmpty());
        assertEquals(List.of(List.of("A"), List.of("B")), SpotFixtures.routeNames(itinerary));
    }

    @Test
    @DisplayName("A single pass may leave the destination day over budget")
    void testSinglePass() {
        Spot a = SpotFixtures.spot("A", 0.0, 0.0);
        Spot b = SpotFixtures.spot("B", 0.0, 0.05);
        Spot c = SpotFixtures.spot("C", 0.0, 0.1);
        Spot d = SpotFixtures.spot("D", 0.0, 0.2);
        Itinerary itinerary = SpotFixtures.itinerary(List.of(a, b, c), List.of(d));

        repairer.repair(itinerary);

        List<DailyBudgetViolation> remaining = checker.checkDailyDistance(itinerary);
        assertEquals(1, remaining.size());
        assertEquals(2, remaining.get(0).getDay());
    }

    @Test
    @DisplayName("Time repair uses the mode ceiling")
    void testTimeRepair() {
        Spot a = SpotFixtures.spot("A", 0.0, 0.0);
        Spot b = SpotFixtures.spot("B", 0.0, 0.25);
        Spot c = SpotFixtures.spot("C", 0.0, 0.26);
        Itinerary itinerary = SpotFixtures.itinerary(List.of(a, b), List.of(c));

        assertTrue(repairer.repair(itinerary.copy(), TransportMode.TAXI).getViolations().isEmpty());

        RepairReport walk = repairer.repair(itinerary, TransportMode.WALK);
        assertEquals(1, walk.getRelocations().size());
        assertEquals(List.of(List.of("A"), List.of("C", "B")), SpotFixtures.routeNames(itinerary));
    }
}
