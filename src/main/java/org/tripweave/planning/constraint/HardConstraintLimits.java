package org.tripweave.planning.constraint;

import lombok.Builder;
import lombok.Value;
import org.tripweave.planning.core.PlanningException;
import org.tripweave.planning.geo.TransportMode;

import java.util.Map;

/**
 * Hard daily ceilings enforced outside the scorer.
 *
 * <p>These caps are independent of {@link org.tripweave.planning.score.ScoreConfig}:
 * the scorer ranks candidates softly, the checker reports days that break a ceiling.</p>
 */
@Value
@Builder(toBuilder = true)
public class HardConstraintLimits {
    public static final String REASON_INVALID = "PLAN_HARD_LIMITS_INVALID";

    /** Daily distance ceiling in kilometers. */
    @Builder.Default
    double maxDailyKm = 6.0d;
    /** Daily travel-time ceiling per mode, in minutes. */
    @Builder.Default
    Map<TransportMode, Double> maxDailyMinutes = Map.of(
            TransportMode.WALK, 240.0d,
            TransportMode.TRANSIT, 300.0d,
            TransportMode.TAXI, 360.0d
    );

    public static HardConstraintLimits defaults() {
        return HardConstraintLimits.builder().build();
    }

    /**
     * Minute ceiling for {@code mode}.
     *
     * @throws PlanningException with {@link #REASON_INVALID} when no ceiling is configured for the mode.
     */
    public double maxDailyMinutes(TransportMode mode) {
        Double limit = maxDailyMinutes == null ? null : maxDailyMinutes.get(mode);
        if (limit == null) {
            throw new PlanningException(REASON_INVALID, "no daily minute limit configured for " + mode);
        }
        return limit;
    }

    /**
     * Validates that every configured ceiling is finite and non-negative.
     *
     * @throws PlanningException with {@link #REASON_INVALID} on the first invalid value.
     */
    public void validate() {
        requireNonNegativeFinite(maxDailyKm, "maxDailyKm");
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
