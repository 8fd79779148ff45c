package org.tripweave.planning.search;

import java.util.Random;

/**
 * Metropolis acceptance with linear cooling.
 *
 * <p>Improvements over the current state are always accepted. A worse candidate is
 * accepted with probability {@code exp(-delta / T)} where
 * {@code T = initialTemperature * (1 - trial / totalTrials)}.</p>
 */
public final class SimulatedAnnealingAcceptance implements AcceptancePolicy {
    public static final String ID = "SIMULATED_ANNEALING";

    private final double initialTemperature;

    /**
     * @param initialTemperature starting temperature in score units, must be positive.
     */
    public SimulatedAnnealingAcceptance(double initialTemperature) {
        if (!Double.isFinite(initialTemperature) || initialTemperature <= 0.0d) {
            throw new IllegalArgumentException("initialTemperature must be finite and > 0, got " + initialTemperature);
        }
        this.initialTemperature = initialTemperature;
    }

    public double initialTemperature() {
        return initialTemperature;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean accept(
            double candidateScore,
            double currentScore,
            double bestScore,
            int trial,
            int totalTrials,
            Random random
    ) {
        if (candidateScore < currentScore) {
            return true;
        }
        double temperature = temperature(trial, totalTrials);
        if (temperature <= 0.0d) {
            return false;
        }
        double delta = candidateScore - currentScore;
        return random.nextDouble() < Math.exp(-delta / temperature);
    }

    double temperature(int trial, int totalTrials) {
        if (totalTrials <= 0) {
            return 0.0d;
        }
        return initialTemperature * (1.0d - (double) trial / totalTrials);
    }
}
