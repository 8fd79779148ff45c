package org.tripweave.planning.score;

import lombok.Builder;
import lombok.Value;
import org.tripweave.planning.core.PlanningException;
import org.tripweave.planning.geo.TransportMode;

import java.util.Map;

/**
 * Immutable soft-constraint weights and budgets for {@link ItineraryScorer}.
 *
 * <p>Distance budgets apply when no transport mode is given; minute budgets apply
 * per mode otherwise. The sparse-day rule only fires when the total spot count
 * would let every day reach {@link #minSpotsPerDay}.</p>
 */
@Value
@Builder(toBuilder = true)
public class ScoreConfig {
    public static final String REASON_INVALID = "PLAN_SCORE_CONFIG_INVALID";

    /** Soft daily distance budget in kilometers. */
    @Builder.Default
    double maxDailyKm = 6.0d;
    /** Penalty per kilometer over {@link #maxDailyKm}. */
    @Builder.Default
    double exceedKmPenalty = 25.0d;
    /** Soft daily travel-time budget per transport mode, in minutes. */
    @Builder.Default
    Map<TransportMode, Double> maxDailyMinutes = Map.of(
            TransportMode.WALK, 240.0d,
            TransportMode.TRANSIT, 300.0d,
            TransportMode.TAXI, 360.0d
    );
    /** Penalty per minute over the mode's daily budget. */
    @Builder.Default
    double exceedMinutePenalty = 1.5d;
    /** Flat penalty for a day holding fewer than {@link #minSpotsPerDay} spots. */
    @Builder.Default
    double oneSpotDayPenalty = 15.0d;
    /** Sparse-day threshold. */
    @Builder.Default
    int minSpotsPerDay = 2;

    /**
     * Returns the default configuration.
     */
    public static ScoreConfig defaults() {
        return ScoreConfig.builder().build();
    }

    /**
     * Daily minute budget for {@code mode}.
     *
     * @throws PlanningException when the mode has no budget configured.
     */
    public double maxDailyMinutes(TransportMode mode) {
        Double budget = maxDailyMinutes == null ? null : maxDailyMinutes.get(mode);
        if (budget == null) {
            throw new PlanningException(REASON_INVALID, "no maxDailyMinutes configured for " + mode);
        }
        return budget;
    }

    /**
     * Validates budgets and weights.
     *
     * @throws PlanningException with {@link #REASON_INVALID} on the first invalid value.
     */
    public void validate() {
        requireNonNegativeFinite(maxDailyKm, "maxDailyKm");
        requireNonNegativeFinite(exceedKmPenalty, "exceedKmPenalty");
        requireNonNegativeFinite(exceedMinutePenalty, "exceedMinutePenalty");
        requireNonNegativeFinite(oneSpotDayPenalty, "oneSpotDayPenalty");
        if (minSpotsPerDay < 0) {
            throw new PlanningException(REASON_INVALID, "minSpotsPerDay must be >= 0, got " + minSpotsPerDay);
        }
        if (maxDailyMinutes == null) {
            throw new PlanningException(REASON_INVALID, "maxDailyMinutes must be provided");
        }
        for (Map.Entry<TransportMode, Double> entry : maxDailyMinutes.entrySet()) {
            if (entry.getValue() == null) {
                throw new PlanningException(REASON_INVALID, "maxDailyMinutes[" + entry.getKey() + "] is null");
            }
            requireNonNegativeFinite(entry.getValue(), "maxDailyMinutes[" + entry.getKey() + "]");
        }
    }

    private static void requireNonNegativeFinite(double value, String fieldName) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new PlanningException(REASON_INVALID, fieldName + " must be finite and >= 0, got " + value);
        }
    }
}
