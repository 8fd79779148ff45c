package org.tripweave.planning.search;

import lombok.Builder;
import lombok.Value;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.score.ScoreResult;

import java.util.List;

/**
 * Best itinerary found by one search run plus run counters.
 */
@Value
@Builder
public class OptimizationResult {
    /** Best itinerary observed across all trials. */
    Itinerary itinerary;
    /** Score of {@link #itinerary}. */
    ScoreResult scoreResult;
    /** Score of the construction seed. */
    double initialScore;
    /** Trials executed, equal to the configured budget. */
    int trialsRun;
    /** Candidates that became the current state. */
    int acceptedMoves;
    /** Candidates that improved the best score. */
    int improvements;
    /** Trials where the chosen operator found no eligible day. */
    int noOpTrials;

    public double score() {
        return scoreResult.getScore();
    }

    public List<String> reasons() {
        return scoreResult.getReasons();
    }
}
