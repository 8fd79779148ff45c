package org.tripweave.planning.construct;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.tripweave.planning.geo.TravelCostModel;
import org.tripweave.planning.model.Spot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy nearest-neighbour route ordering.
 *
 * <p>Starts at the first input spot and repeatedly appends the unvisited spot with the
 * lowest leg cost from the last appended one. Ties keep the earliest remaining spot.
 * Quadratic in day size, which stays in the tens of spots.</p>
 */
public final class NearestNeighborRouter {
    private final TravelCostModel costModel;

    public NearestNeighborRouter(TravelCostModel costModel) {
        this.costModel = Objects.requireNonNull(costModel, "costModel");
    }

    public TravelCostModel costModel() {
        return costModel;
    }

    /**
     * Returns a new list holding {@code spots} in nearest-neighbour order.
     */
    public List<Spot> order(List<Spot> spots) {
        Objects.requireNonNull(spots, "spots");
        if (spots.size() <= 1) {
            return new ArrayList<>(spots);
        }

        IntArrayList unvisited = new IntArrayList(spots.size() - 1);
        for (int i = 1; i < spots.size(); i++) {
            unvisited.add(i);
        }

        List<Spot> path = new ArrayList<>(spots.size());
        Spot last = spots.get(0);
        path.add(last);
        while (!unvisited.isEmpty()) {
            int bestPosition = 0;
            double bestCost = Double.POSITIVE_INFINITY;
            for (int position = 0; position < unvisited.size(); position++) {
                double cost = costModel.legCost(last, spots.get(unvisited.getInt(position)));
                if (cost < bestCost) {
                    bestCost = cost;
                    bestPosition = position;
                }
            }
            last = spots.get(unvisited.removeInt(bestPosition));
            path.add(last);
        }
        return path;
    }
}
