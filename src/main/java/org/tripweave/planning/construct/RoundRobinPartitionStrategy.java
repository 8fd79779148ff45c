package org.tripweave.planning.construct;

import org.tripweave.planning.model.Spot;

import java.util.ArrayList;
import java.util.List;

/**
 * Deals spot {@code i} to day {@code i mod dayCount}.
 *
 * <p>Lossless, and day sizes differ by at most one. Spatial locality is interleaved
 * rather than contiguous.</p>
 */
public final class RoundRobinPartitionStrategy implements PartitionStrategy {

    @Override
    public String id() {
        return PartitionStrategyRegistry.STRATEGY_ROUND_ROBIN;
    }

    @Override
    public List<List<Spot>> partition(List<Spot> sortedSpots, int dayCount) {
        List<List<Spot>> groups = new ArrayList<>(dayCount);
        for (int i = 0; i < dayCount; i++) {
            groups.add(new ArrayList<>());
        }
        for (int i = 0; i < sortedSpots.size(); i++) {
            groups.get(i % dayCount).add(sortedSpots.get(i));
        }
        return groups;
    }
}
