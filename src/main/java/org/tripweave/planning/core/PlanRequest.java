package org.tripweave.planning.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.tripweave.planning.construct.PartitionStrategyRegistry;
import org.tripweave.planning.constraint.HardConstraintLimits;
import org.tripweave.planning.geo.TransportMode;
import org.tripweave.planning.model.Spot;
import org.tripweave.planning.score.ScoreConfig;
import org.tripweave.planning.search.OptimizerConfig;

import java.util.List;

/**
 * Client-facing planning request.
 *
 * <p>Spots are expected to be validated already by the loading layer. A null
 * {@link #transportMode} selects distance-based costing throughout.</p>
 */
@Value
@Builder
public class PlanRequest {
    /** Opaque city label. */
    String city;
    /** Spots to distribute; each ends up in exactly one day unless repair drops it. */
    @Singular
    List<Spot> spots;
    /** Number of days, must be positive. */
    int dayCount;
    /** Soft scorer configuration. */
    @Builder.Default
    ScoreConfig scoreConfig = ScoreConfig.defaults();
    /** Hard ceilings used by the optional repair pass. */
    @Builder.Default
    HardConstraintLimits hardLimits = HardConstraintLimits.defaults();
    /** Search budget, seed and acceptance rule. */
    @Builder.Default
    OptimizerConfig optimizerConfig = OptimizerConfig.defaults();
    /** Transport mode for time-based costing, or null for distance. */
    TransportMode transportMode;
    /** Partition strategy id from {@link PartitionStrategyRegistry}. */
    @Builder.Default
    String partitionStrategyId = PartitionStrategyRegistry.DEFAULT_STRATEGY_ID;
    /** Runs the hard-ceiling repair pass after search. */
    boolean repairHardConstraints;
    /** Runs the indoor/outdoor balancing pass after search (and repair). */
    boolean balanceIndoorOutdoor;
}
