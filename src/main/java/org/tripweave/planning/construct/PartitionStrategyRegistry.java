package org.tripweave.planning.construct;

import org.tripweave.planning.core.PlanningException;

import java.util.Map;
import java.util.Set;

/**
 * Lookup of the built-in day-partition strategies by id.
 */
public final class PartitionStrategyRegistry {
    public static final String STRATEGY_ROUND_ROBIN = "ROUND_ROBIN";
    public static final String STRATEGY_CHUNKED = "CHUNKED";
    public static final String DEFAULT_STRATEGY_ID = STRATEGY_ROUND_ROBIN;

    public static final String REASON_UNKNOWN_STRATEGY = "PLAN_PARTITION_STRATEGY_UNKNOWN";

    private static final PartitionStrategyRegistry DEFAULT = new PartitionStrategyRegistry();

    private final Map<String, PartitionStrategy> strategiesById = Map.of(
            STRATEGY_ROUND_ROBIN, new RoundRobinPartitionStrategy(),
            STRATEGY_CHUNKED, new ChunkedPartitionStrategy()
    );

    private PartitionStrategyRegistry() {
    }

    /**
     * Resolves a strategy id; surrounding whitespace is ignored.
     *
     * @throws PlanningException with {@link #REASON_UNKNOWN_STRATEGY} for a null or unregistered id.
     */
    public PartitionStrategy require(String strategyId) {
        PartitionStrategy strategy = strategyId == null ? null : strategiesById.get(strategyId.trim());
        if (strategy == null) {
            throw new PlanningException(
                    REASON_UNKNOWN_STRATEGY,
                    "unknown partition strategy '" + strategyId + "', registered: " + strategyIds()
            );
        }
        return strategy;
    }

    /**
     * Lossless round-robin strategy.
     */
    public PartitionStrategy defaultStrategy() {
        return require(DEFAULT_STRATEGY_ID);
    }

    public Set<String> strategyIds() {
        return strategiesById.keySet();
    }

    public static PartitionStrategyRegistry defaultRegistry() {
        return DEFAULT;
    }
}
