package org.tripweave.planning.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Acceptance policy Tests")
class AcceptancePolicyTest {

    @Test
    @DisplayName("Strict improvement compares against the best score without drawing randomness")
    void testStrictImprovement() {
        AcceptancePolicy strict = new StrictImprovementAcceptance();
        assertEquals(StrictImprovementAcceptance.ID, strict.id());
        assertTrue(strict.accept(9.0d, 12.0d, 10.0d, 0, 10, null));
        assertFalse(strict.accept(10.0d, 12.0d, 10.0d, 0, 10, null));
        assertFalse(strict.accept(11.0d, 12.0d, 10.0d, 0, 10, null));
    }

    @Test
    @DisplayName("Annealing always accepts improvements over the current state")
    void testAnnealingImprovement() {
        AcceptancePolicy annealing = new SimulatedAnnealingAcceptance(10.0d);
        assertEquals(SimulatedAnnealingAcceptance.ID, annealing.id());
        assertTrue(annealing.accept(11.0d, 12.0d, 5.0d, 99, 100, null));
    }

    @Test
    @DisplayName("Temperature cools linearly to zero")
    void testTemperature() {
        SimulatedAnnealingAcceptance annealing = new SimulatedAnnealingAcceptance(10.0d);
        assertEquals(10.0d, annealing.temperature(0, 100), 1e-9);
        assertEquals(5.0d, annealing.temperature(50, 100), 1e-9);
        assertEquals(0.0d, annealing.temperature(100, 100), 1e-9);
        assertEquals(0.0d, annealing.temperature(0, 0), 1e-9);
    }

    @Test
    @DisplayName("Worse candidates pass with probability exp(-delta / T)")
    void testAnnealingWorseCandidates() {
        SimulatedAnnealingAcceptance hot = new SimulatedAnnealingAcceptance(1.0e9d);
        Random random = new Random(42L);
        int acceptedHot = 0;
        for (int i = 0; i < 100; i++) {
            if (hot.accept(11.0d, 10.0d, 10.0d, 0, 100, random)) {
                acceptedHot++;
            }
        }
        assertEquals(100, acceptedHot);

        SimulatedAnnealingAcceptance cold = new SimulatedAnnealingAcceptance(1.0e-3d);
        for (int i = 0; i < 100; i++) {
            assertFalse(cold.accept(20.0d, 10.0d, 10.0d, 0, 100, random));
        }
        assertFalse(hot.accept(11.0d, 10.0d, 10.0d, 100, 100, random));
    }

    @Test
    @DisplayName("Initial temperature must be positive and finite")
    void testInvalidTemperature() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedAnnealingAcceptance(0.0d));
        assertThrows(IllegalArgumentException.class, () -> new SimulatedAnnealingAcceptance(-1.0d));
        assertThrows(IllegalArgumentException.class, () -> new SimulatedAnnealingAcceptance(Double.NaN));
    }
}
