package org.tripweave.planning.search;

import java.util.Random;

/**
 * Decides whether a scored candidate replaces the current search state.
 *
 * <p>The best-so-far itinerary is tracked by the optimizer independently of this
 * decision and is only replaced on strict improvement.</p>
 */
public interface AcceptancePolicy {

    /**
     * Stable policy identifier.
     */
    String id();

    /**
     * @param candidateScore score of the mutated candidate.
     * @param currentScore score of the state the candidate was derived from.
     * @param bestScore best score seen so far.
     * @param trial zero-based trial index.
     * @param totalTrials trial budget of the run.
     * @param random run-owned random stream; policies that never draw keep runs reproducible
     *               against the operator stream.
     * @return true when the candidate becomes the new current state.
     */
    boolean accept(
            double candidateScore,
            double currentScore,
            double bestScore,
            int trial,
            int totalTrials,
            Random random
    );
}
