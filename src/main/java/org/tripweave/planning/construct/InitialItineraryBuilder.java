package org.tripweave.planning.construct;

import org.tripweave.planning.core.PlanningException;
import org.tripweave.planning.model.DayPlan;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.model.Spot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Seed construction: spatial sort, day partition, per-day nearest-neighbour routing.
 */
public final class InitialItineraryBuilder {
    public static final String REASON_DAY_COUNT_INVALID = "PLAN_DAY_COUNT_INVALID";

    /** Cheap locality proxy: spots close in longitude land in similar days. */
    static final Comparator<Spot> SPATIAL_ORDER = Comparator
            .comparingDouble(Spot::lon)
            .thenComparingDouble(Spot::lat);

    private final PartitionStrategy partitionStrategy;
    private final NearestNeighborRouter router;

    public InitialItineraryBuilder(PartitionStrategy partitionStrategy, NearestNeighborRouter router) {
        this.partitionStrategy = Objects.requireNonNull(partitionStrategy, "partitionStrategy");
        this.router = Objects.requireNonNull(router, "router");
    }

    public PartitionStrategy partitionStrategy() {
        return partitionStrategy;
    }

    public NearestNeighborRouter router() {
        return router;
    }

    /**
     * Builds the seed itinerary.
     *
     * @param city opaque city label.
     * @param spots input spots (not modified).
     * @param dayCount number of days, must be positive.
     * @throws PlanningException with {@link #REASON_DAY_COUNT_INVALID} when {@code dayCount <= 0}.
     */
    public Itinerary build(String city, List<Spot> spots, int dayCount) {
        Objects.requireNonNull(city, "city");
        Objects.requireNonNull(spots, "spots");
        requirePositiveDayCount(dayCount);

        List<Spot> sorted = new ArrayList<>(spots);
        sorted.sort(SPATIAL_ORDER);

        List<List<Spot>> groups = partitionStrategy.partition(sorted, dayCount);
        if (groups.size() != dayCount) {
            throw new IllegalStateException(
                    "partition strategy " + partitionStrategy.id() + " returned " + groups.size()
                            + " groups for " + dayCount + " days"
            );
        }

        List<DayPlan> days = new ArrayList<>(dayCount);
        for (int i = 0; i < dayCount; i++) {
            days.add(new DayPlan(i + 1, router.order(groups.get(i))));
        }
        return new Itinerary(city, days);
    }

    /**
     * Validates the day-count contract.
     */
    public static void requirePositiveDayCount(int dayCount) {
        if (dayCount <= 0) {
            throw new PlanningException(REASON_DAY_COUNT_INVALID, "dayCount must be > 0, got " + dayCount);
        }
    }
}
