package org.tripweave.planning.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.tripweave.planning.construct.NearestNeighborRouter;
import org.tripweave.planning.model.DayPlan;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.model.Spot;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Moves one random spot from a random day holding at least two spots to a random other day,
 * then re-routes both days.
 */
public final class MoveSpotMutation implements MutationOperator {
    public static final String ID = "MOVE";

    private final NearestNeighborRouter router;

    public MoveSpotMutation(NearestNeighborRouter router) {
        this.router = Objects.requireNonNull(router, "router");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean mutate(Itinerary candidate, Random random) {
        List<DayPlan> days = candidate.days();
        if (days.size() < 2) {
            return false;
        }
        IntArrayList sources = new IntArrayList(days.size());
        for (int i = 0; i < days.size(); i++) {
            if (days.get(i).size() >= 2) {
                sources.add(i);
            }
        }
        if (sources.isEmpty()) {
            return false;
        }

        int sourceIndex = sources.getInt(random.nextInt(sources.size()));
        DayPlan source = days.get(sourceIndex);
        Spot moved = source.removeAt(random.nextInt(source.size()));

        // uniform over the other days
        int targetIndex = random.nextInt(days.size() - 1);
        if (targetIndex >= sourceIndex) {
            targetIndex++;
        }
        DayPlan target = days.get(targetIndex);
        target.append(moved);

        reroute(source);
        reroute(target);
        return true;
    }

    private void reroute(DayPlan day) {
        day.replaceRoute(router.order(day.spots()));
    }
}
