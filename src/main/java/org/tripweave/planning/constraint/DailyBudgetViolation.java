package org.tripweave.planning.constraint;

import lombok.Value;
import org.tripweave.planning.geo.TransportMode;

/**
 * One day whose route breaks a hard ceiling.
 */
@Value
public class DailyBudgetViolation {
    /** 1-based day number. */
    int day;
    /** Measured route total, unrounded (km, or minutes for a time violation). */
    double measured;
    /** Ceiling that was exceeded. */
    double limit;
    /** Mode of a time violation, or null for a distance violation. */
    TransportMode mode;

    public boolean isTimeViolation() {
        return mode != null;
    }

    public double excess() {
        return measured - limit;
    }
}
