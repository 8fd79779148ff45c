package org.tripweave.planning.construct;

import org.tripweave.planning.model.Spot;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts the sorted sequence into contiguous blocks of {@code max(1, n / dayCount)} spots.
 *
 * <p>Blocks beyond {@code dayCount} are discarded, so a remainder that does not divide
 * evenly is lost. When there are fewer blocks than days, trailing days stay empty.</p>
 */
public final class ChunkedPartitionStrategy implements PartitionStrategy {

    @Override
    public String id() {
        return PartitionStrategyRegistry.STRATEGY_CHUNKED;
    }

    @Override
    public List<List<Spot>> partition(List<Spot> sortedSpots, int dayCount) {
        int chunkSize = Math.max(1, sortedSpots.size() / dayCount);
        List<List<Spot>> groups = new ArrayList<>(dayCount);
        for (int start = 0; start < sortedSpots.size() && groups.size() < dayCount; start += chunkSize) {
            int end = Math.min(sortedSpots.size(), start + chunkSize);
            groups.add(new ArrayList<>(sortedSpots.subList(start, end)));
        }
        while (groups.size() < dayCount) {
            groups.add(new ArrayList<>());
        }
        return groups;
    }
}
