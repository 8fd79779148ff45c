package org.tripweave.planning.model;

import org.tripweave.planning.geo.TravelCostModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One day of an itinerary: a 1-based day number and the ordered visiting route.
 *
 * <p>The route order is the travel order. Route totals are derived on every call and
 * never cached, so they stay correct after in-place mutation by repair, balancing or
 * search operators.</p>
 */
public final class DayPlan {
    private final int day;
    private final List<Spot> route;

    /**
     * Creates a day with an initial route.
     *
     * @param day 1-based day number.
     * @param route initial visiting order (copied).
     */
    public DayPlan(int day, Collection<Spot> route) {
        if (day < 1) {
            throw new IllegalArgumentException("day must be >= 1, got " + day);
        }
        this.day = day;
        this.route = new ArrayList<>(Objects.requireNonNull(route, "route"));
        for (Spot spot : this.route) {
            Objects.requireNonNull(spot, "route spot");
        }
    }

    /**
     * Creates an empty day.
     */
    public static DayPlan empty(int day) {
        return new DayPlan(day, List.of());
    }

    public int day() {
        return day;
    }

    /**
     * Read-only view of the route in visiting order.
     */
    public List<Spot> spots() {
        return Collections.unmodifiableList(route);
    }

    public int size() {
        return route.size();
    }

    public boolean isEmpty() {
        return route.isEmpty();
    }

    public Spot spotAt(int index) {
        return route.get(index);
    }

    /**
     * Last spot of the route, or null when the day is empty.
     */
    public Spot lastSpot() {
        return route.isEmpty() ? null : route.get(route.size() - 1);
    }

    public boolean contains(Spot spot) {
        return route.contains(spot);
    }

    /**
     * Appends a spot to the end of the route.
     */
    public void append(Spot spot) {
        route.add(Objects.requireNonNull(spot, "spot"));
    }

    /**
     * Removes and returns the spot at {@code index}.
     */
    public Spot removeAt(int index) {
        return route.remove(index);
    }

    /**
     * Removes and returns the last spot.
     *
     * @throws IllegalStateException when the day is empty.
     */
    public Spot removeLast() {
        if (route.isEmpty()) {
            throw new IllegalStateException("day " + day + " has no spots to remove");
        }
        return route.remove(route.size() - 1);
    }

    /**
     * Replaces the route with a new visiting order.
     */
    public void replaceRoute(List<Spot> newRoute) {
        Objects.requireNonNull(newRoute, "newRoute");
        List<Spot> copy = new ArrayList<>(newRoute);
        route.clear();
        route.addAll(copy);
    }

    /**
     * Flat-distance route length in kilometers.
     */
    public double totalDistanceKm() {
        return TravelCostModel.distance().routeCost(route);
    }

    /**
     * Route cost under an arbitrary travel cost model.
     */
    public double totalCost(TravelCostModel costModel) {
        return costModel.routeCost(route);
    }

    /**
     * Independent copy sharing the (immutable) spots.
     */
    public DayPlan copy() {
        return new DayPlan(day, route);
    }

    @Override
    public String toString() {
        return "DayPlan{day=" + day + ", spots=" + route.size() + "}";
    }
}
