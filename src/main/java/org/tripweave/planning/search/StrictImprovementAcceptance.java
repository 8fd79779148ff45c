package org.tripweave.planning.search;

import java.util.Random;

/**
 * Pure hill-climbing: accepts only candidates strictly better than the best score.
 *
 * <p>Current and best therefore always coincide. There is no escape from local optima.</p>
 */
public final class StrictImprovementAcceptance implements AcceptancePolicy {
    public static final String ID = "STRICT_IMPROVEMENT";

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
        return candidateScore < bestScore;
    }
}
