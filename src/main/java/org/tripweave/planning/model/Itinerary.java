package org.tripweave.planning.model;

import org.tripweave.planning.core.PlanningException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Multi-day plan for one city.
 *
 * <p>The day sequence is fixed for the lifetime of the instance; day numbers are
 * contiguous {@code 1..n} and match list position. Spot membership inside days is
 * mutable so that repair, balancing and search operators can work in place.</p>
 */
public final class Itinerary {
    public static final String REASON_DAY_UNKNOWN = "PLAN_DAY_UNKNOWN";

    private final String city;
    private final List<DayPlan> days;

    /**
     * Creates an itinerary from already numbered days.
     *
     * @param city opaque city label.
     * @param days days numbered {@code 1..n} in order.
     */
    public Itinerary(String city, List<DayPlan> days) {
        this.city = Objects.requireNonNull(city, "city");
        Objects.requireNonNull(days, "days");
        List<DayPlan> copy = new ArrayList<>(days.size());
        for (int i = 0; i < days.size(); i++) {
            DayPlan dayPlan = Objects.requireNonNull(days.get(i), "day");
            if (dayPlan.day() != i + 1) {
                throw new IllegalArgumentException(
                        "day numbers must be contiguous from 1: position " + i + " holds day " + dayPlan.day()
                );
            }
            copy.add(dayPlan);
        }
        this.days = Collections.unmodifiableList(copy);
    }

    /**
     * Creates an itinerary with {@code dayCount} empty days.
     */
    public static Itinerary empty(String city, int dayCount) {
        List<DayPlan> days = new ArrayList<>(Math.max(0, dayCount));
        for (int day = 1; day <= dayCount; day++) {
            days.add(DayPlan.empty(day));
        }
        return new Itinerary(city, days);
    }

    public String city() {
        return city;
    }

    /**
     * Days in order. The list is fixed; each {@link DayPlan} is mutable.
     */
    public List<DayPlan> days() {
        return days;
    }

    public int dayCount() {
        return days.size();
    }

    /**
     * Looks up a day by its 1-based number.
     *
     * @throws PlanningException with {@link #REASON_DAY_UNKNOWN} when out of range.
     */
    public DayPlan day(int dayNumber) {
        if (dayNumber < 1 || dayNumber > days.size()) {
            throw new PlanningException(
                    REASON_DAY_UNKNOWN,
                    "day " + dayNumber + " not in [1, " + days.size() + "]"
            );
        }
        return days.get(dayNumber - 1);
    }

    public int totalSpotCount() {
        int total = 0;
        for (DayPlan day : days) {
            total += day.size();
        }
        return total;
    }

    /**
     * All spots in day order, then route order.
     */
    public List<Spot> allSpots() {
        List<Spot> all = new ArrayList<>(totalSpotCount());
        for (DayPlan day : days) {
            all.addAll(day.spots());
        }
        return all;
    }

    /**
     * Deep copy of the day structure. Spots are shared since they are immutable.
     */
    public Itinerary copy() {
        List<DayPlan> copied = new ArrayList<>(days.size());
        for (DayPlan day : days) {
            copied.add(day.copy());
        }
        return new Itinerary(city, copied);
    }

    @Override
    public String toString() {
        return "Itinerary{city=" + city + ", days=" + days + "}";
    }
}
