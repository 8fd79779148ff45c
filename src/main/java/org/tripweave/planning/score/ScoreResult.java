package org.tripweave.planning.score;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one scoring pass.
 */
@Value
@Builder
public class ScoreResult {
    /** Total cost; lower is better. */
    double score;
    /** Unit of {@link #dayCosts} ({@code km} or {@code min}). */
    String unit;
    /** Human-readable penalty reasons in day order. */
    @Singular
    List<String> reasons;
    /** Raw route cost per day, index 0 is day 1. */
    @Singular
    List<Double> dayCosts;

    /**
     * Returns true when no penalty was applied.
     */
    public boolean isClean() {
        return reasons.isEmpty();
    }
}
