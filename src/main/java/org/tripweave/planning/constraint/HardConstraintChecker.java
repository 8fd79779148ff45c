package org.tripweave.planning.constraint;

import org.tripweave.planning.geo.TransportMode;
import org.tripweave.planning.geo.TravelCostModel;
import org.tripweave.planning.model.DayPlan;
import org.tripweave.planning.model.Itinerary;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Detects days whose route total exceeds a hard ceiling.
 */
public final class HardConstraintChecker {
    private final HardConstraintLimits limits;

    /**
     * @throws org.tripweave.planning.core.PlanningException when {@code limits} are invalid.
     */
    public HardConstraintChecker(HardConstraintLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
        limits.validate();
    }

    public HardConstraintLimits limits() {
        return limits;
    }

    /**
     * Reports days over the distance ceiling.
     */
    public List<DailyBudgetViolation> checkDailyDistance(Itinerary itinerary) {
        Objects.requireNonNull(itinerary, "itinerary");
        List<DailyBudgetViolation> violations = new ArrayList<>();
        double limit = limits.getMaxDailyKm();
        for (DayPlan day : itinerary.days()) {
            double total = day.totalDistanceKm();
            if (total > limit) {
                violations.add(new DailyBudgetViolation(day.day(), total, limit, null));
            }
        }
        return violations;
    }

    /**
     * Reports days over the travel-time ceiling of {@code mode}.
     */
    public List<DailyBudgetViolation> checkDailyTime(Itinerary itinerary, TransportMode mode) {
        Objects.requireNonNull(itinerary, "itinerary");
        Objects.requireNonNull(mode, "mode");
        List<DailyBudgetViolation> violations = new ArrayList<>();
        TravelCostModel costModel = TravelCostModel.of(mode);
        double limit = limits.maxDailyMinutes(mode);
        for (DayPlan day : itinerary.days()) {
            double total = day.totalCost(costModel);
            if (total > limit) {
                violations.add(new DailyBudgetViolation(day.day(), total, limit, mode));
            }
        }
        return violations;
    }

    /**
     * Time check when {@code mode} is given, distance check otherwise.
     */
    public List<DailyBudgetViolation> check(Itinerary itinerary, TransportMode mode) {
        if (mode == null) {
            return checkDailyDistance(itinerary);
        }
        return checkDailyTime(itinerary, mode);
    }
}
