package org.tripweave.planning.construct;

import org.tripweave.planning.model.Spot;

import java.util.List;

/**
 * Strategy contract for splitting a spatially sorted spot sequence across days.
 */
public interface PartitionStrategy {

    /**
     * Stable strategy identifier.
     */
    String id();

    /**
     * Splits {@code sortedSpots} into exactly {@code dayCount} groups, index 0 being day 1.
     *
     * <p>Groups may be empty. Whether every input spot is retained depends on the strategy.</p>
     *
     * @param sortedSpots spots already sorted by (longitude, latitude).
     * @param dayCount positive number of days.
     */
    List<List<Spot>> partition(List<Spot> sortedSpots, int dayCount);
}
