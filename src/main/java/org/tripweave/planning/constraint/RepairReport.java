package org.tripweave.planning.constraint;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.tripweave.planning.model.Spot;

import java.util.List;

/**
 * Outcome of one repair pass.
 *
 * <p>{@link #droppedSpots} holds spots removed from an over-budget day for which no
 * destination day existed. Those spots are no longer part of the itinerary; callers
 * decide whether to re-insert them, surface them, or fail the plan.</p>
 */
@Value
@Builder
public class RepairReport {
    /** Violations found before the pass ran. */
    @Singular
    List<DailyBudgetViolation> violations;
    /** Spots moved to another day. */
    @Singular
    List<Relocation> relocations;
    /** Violating days left untouched because they hold a single spot. */
    @Singular
    List<Integer> skippedDays;
    /** Spots removed without a destination day. */
    @Singular
    List<Spot> droppedSpots;

    /**
     * True when no spot was lost during the pass.
     */
    public boolean isComplete() {
        return droppedSpots.isEmpty();
    }

    /**
     * One spot moved from one day to another.
     */
    @Value
    public static class Relocation {
        Spot spot;
        int fromDay;
        int toDay;
    }
}
