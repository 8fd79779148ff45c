package org.tripweave.planning.search;

import lombok.Builder;
import lombok.Value;
import org.tripweave.planning.core.PlanningException;

/**
 * Search budget and randomness settings for {@link LocalSearchOptimizer}.
 */
@Value
@Builder(toBuilder = true)
public class OptimizerConfig {
    public static final String REASON_TRIALS_INVALID = "PLAN_TRIALS_INVALID";
    public static final int DEFAULT_TRIALS = 200;
    public static final long DEFAULT_SEED = 42L;

    /** Number of mutation trials; zero returns the construction output. */
    @Builder.Default
    int trials = DEFAULT_TRIALS;
    /** Seed of the run-owned random stream. */
    @Builder.Default
    long seed = DEFAULT_SEED;
    /** Probability of picking the move operator; the swap operator otherwise. */
    @Builder.Default
    double moveProbability = 0.6d;
    /** Candidate acceptance rule. */
    @Builder.Default
    AcceptancePolicy acceptancePolicy = new StrictImprovementAcceptance();

    public static OptimizerConfig defaults() {
        return OptimizerConfig.builder().build();
    }

    /**
     * Returns the default configuration with a different trial budget.
     */
    public static OptimizerConfig withTrials(int trials) {
        return OptimizerConfig.builder().trials(trials).build();
    }

    /**
     * Validates the configuration.
     *
     * @throws PlanningException with {@link #REASON_TRIALS_INVALID} for a negative trial budget.
     */
    public void validate() {
        if (trials < 0) {
            throw new PlanningException(REASON_TRIALS_INVALID, "trials must be >= 0, got " + trials);
        }
        if (!Double.isFinite(moveProbability) || moveProbability < 0.0d || moveProbability > 1.0d) {
            throw new IllegalArgumentException("moveProbability must be in [0, 1], got " + moveProbability);
        }
        if (acceptancePolicy == null) {
            throw new IllegalArgumentException("acceptancePolicy must be provided");
        }
    }
}
