package org.tripweave.planning.balance;

import lombok.extern.slf4j.Slf4j;
import org.tripweave.planning.model.DayPlan;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.model.Spot;
import org.tripweave.planning.semantics.SpotClassifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Best-effort indoor/outdoor mixing across days.
 *
 * <p>One call performs at most one swap. Swapped spots are appended to the end of
 * their new day; routes are not otherwise re-ordered.</p>
 */
@Slf4j
public final class IndoorOutdoorBalancer {

    /**
     * Swaps the first outdoor spot of {@code dayNumber} with the first indoor spot of the
     * first other day (in day order) that holds one.
     *
     * @return true when a swap happened; false when the day has no outdoor spot or no
     *         other day holds an indoor spot (the itinerary is left untouched).
     */
    public boolean rebalanceDay(Itinerary itinerary, int dayNumber) {
        Objects.requireNonNull(itinerary, "itinerary");
        DayPlan target = itinerary.day(dayNumber);

        int outdoorIndex = firstMatching(target, true);
        if (outdoorIndex < 0) {
            return false;
        }

        for (DayPlan donor : itinerary.days()) {
            if (donor.day() == target.day()) {
                continue;
            }
            int indoorIndex = firstMatching(donor, false);
            if (indoorIndex < 0) {
                continue;
            }
            // positional removal: spots sharing name and coordinates must not be confused
            Spot outdoor = target.removeAt(outdoorIndex);
            Spot indoor = donor.removeAt(indoorIndex);
            target.append(indoor);
            donor.append(outdoor);
            log.debug(
                    "balanced day {}: swapped outdoor '{}' with indoor '{}' from day {}",
                    target.day(), outdoor.name(), indoor.name(), donor.day()
            );
            return true;
        }
        return false;
    }

    /**
     * True when the day is non-empty and every spot is outdoor.
     */
    public boolean isAllOutdoor(DayPlan day) {
        if (day.isEmpty()) {
            return false;
        }
        for (Spot spot : day.spots()) {
            if (!SpotClassifier.isOutdoor(spot)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Runs {@link #rebalanceDay(Itinerary, int)} for each day that is all-outdoor at the
     * moment it is visited.
     *
     * @return day numbers that received an indoor spot.
     */
    public List<Integer> rebalanceAllOutdoorDays(Itinerary itinerary) {
        Objects.requireNonNull(itinerary, "itinerary");
        List<Integer> balanced = new ArrayList<>();
        for (DayPlan day : itinerary.days()) {
            if (isAllOutdoor(day) && rebalanceDay(itinerary, day.day())) {
                balanced.add(day.day());
            }
        }
        return balanced;
    }

    private static int firstMatching(DayPlan day, boolean outdoor) {
        List<Spot> spots = day.spots();
        for (int i = 0; i < spots.size(); i++) {
            Spot spot = spots.get(i);
            if (outdoor ? SpotClassifier.isOutdoor(spot) : SpotClassifier.isIndoor(spot)) {
                return i;
            }
        }
        return -1;
    }
}
