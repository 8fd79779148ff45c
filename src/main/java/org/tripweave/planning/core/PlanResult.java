package org.tripweave.planning.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.tripweave.planning.constraint.DailyBudgetViolation;
import org.tripweave.planning.constraint.RepairReport;
import org.tripweave.planning.geo.TransportMode;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.score.ScoreResult;

import java.util.List;

/**
 * Client-facing planning result.
 *
 * <p>{@link #finalScore} scores the itinerary after all post-passes; it can be worse
 * than {@link #optimizerScore} since repair and balancing ignore the soft scorer.</p>
 */
@Value
@Builder
public class PlanResult {
    /** Final itinerary. */
    Itinerary itinerary;
    /** Transport mode echoed for traceability, or null for distance costing. */
    TransportMode transportMode;
    /** Score of the final itinerary. */
    ScoreResult finalScore;
    /** Best score reached by the search, before post-passes. */
    double optimizerScore;
    /** Trials executed by the search. */
    int trialsRun;
    /** Repair outcome, or null when repair was not requested. */
    RepairReport repairReport;
    /** Days that received an indoor spot from the balancing pass. */
    @Singular
    List<Integer> balancedDays;
    /** Hard-ceiling violations still present in the final itinerary. */
    @Singular
    List<DailyBudgetViolation> remainingViolations;

    public double score() {
        return finalScore.getScore();
    }

    public List<String> reasons() {
        return finalScore.getReasons();
    }
}
