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
 * Exchanges one random spot between two distinct random non-empty days, then re-routes both.
 */
public final class SwapSpotMutation implements MutationOperator {
    public static final String ID = "SWAP";

    private final NearestNeighborRouter router;

    public SwapSpotMutation(NearestNeighborRouter router) {
        this.router = Objects.requireNonNull(router, "router");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean mutate(Itinerary candidate, Random random) {
        List<DayPlan> days = candidate.days();
        IntArrayList eligible = new IntArrayList(days.size());
        for (int i = 0; i < days.size(); i++) {
            if (!days.get(i).isEmpty()) {
                eligible.add(i);
            }
        }
        if (eligible.size() < 2) {
            return false;
        }

        int firstPosition = random.nextInt(eligible.size());
        int secondPosition = random.nextInt(eligible.size() - 1);
        if (secondPosition >= firstPosition) {
            secondPosition++;
        }
        DayPlan first = days.get(eligible.getInt(firstPosition));
        DayPlan second = days.get(eligible.getInt(secondPosition));

        Spot fromFirst = first.removeAt(random.nextInt(first.size()));
        Spot fromSecond = second.removeAt(random.nextInt(second.size()));
        first.append(fromSecond);
        second.append(fromFirst);

        first.replaceRoute(router.order(first.spots()));
        second.replaceRoute(router.order(second.spots()));
        return true;
    }
}
