package org.tripweave.planning.constraint;

import lombok.extern.slf4j.Slf4j;
import org.tripweave.planning.geo.GeoDistance;
import org.tripweave.planning.geo.TransportMode;
import org.tripweave.planning.model.DayPlan;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.model.Spot;

import java.util.List;
import java.util.Objects;

/**
 * Single-pass, in-place repair of hard-ceiling violations.
 *
 * <p>Violations are computed once up front. For each violating day holding more than
 * one spot, the last spot of the route is removed and appended to the other non-empty
 * day whose current last spot is nearest (first day wins ties). The destination route
 * is not re-ordered. A single pass is not guaranteed to clear every violation, so
 * callers re-run the checker afterwards.</p>
 */
@Slf4j
public final class ItineraryRepairer {
    private final HardConstraintChecker checker;

    public ItineraryRepairer(HardConstraintChecker checker) {
        this.checker = Objects.requireNonNull(checker, "checker");
    }

    /**
     * Repairs distance-ceiling violations.
     */
    public RepairReport repair(Itinerary itinerary) {
        return repair(itinerary, null);
    }

    /**
     * Repairs time-ceiling violations of {@code mode}, or distance violations when mode is null.
     */
    public RepairReport repair(Itinerary itinerary, TransportMode mode) {
        Objects.requireNonNull(itinerary, "itinerary");
        List<DailyBudgetViolation> violations = checker.check(itinerary, mode);
        RepairReport.RepairReportBuilder report = RepairReport.builder().violations(violations);

        for (DailyBudgetViolation violation : violations) {
            DayPlan day = itinerary.day(violation.getDay());
            if (day.size() <= 1) {
                report.skippedDay(day.day());
                continue;
            }

            Spot moved = day.removeLast();
            DayPlan target = nearestOtherDay(itinerary, day, moved);
            if (target == null) {
                log.warn("repair dropped spot '{}' from day {}: no other non-empty day", moved.name(), day.day());
                report.droppedSpot(moved);
                continue;
            }
            target.append(moved);
            report.relocation(new RepairReport.Relocation(moved, day.day(), target.day()));
            log.debug("repair moved spot '{}' from day {} to day {}", moved.name(), day.day(), target.day());
        }
        return report.build();
    }

    private static DayPlan nearestOtherDay(Itinerary itinerary, DayPlan source, Spot moved) {
        DayPlan target = null;
        double minDistance = Double.POSITIVE_INFINITY;
        for (DayPlan other : itinerary.days()) {
            if (other.day() == source.day() || other.isEmpty()) {
                continue;
            }
            double distance = GeoDistance.flatDistanceKm(moved, other.lastSpot());
            if (distance < minDistance) {
                minDistance = distance;
                target = other;
            }
        }
        return target;
    }
}
