package org.tripweave.planning.core;

import lombok.extern.slf4j.Slf4j;
import org.tripweave.planning.balance.IndoorOutdoorBalancer;
import org.tripweave.planning.construct.InitialItineraryBuilder;
import org.tripweave.planning.construct.PartitionStrategy;
import org.tripweave.planning.construct.PartitionStrategyRegistry;
import org.tripweave.planning.constraint.DailyBudgetViolation;
import org.tripweave.planning.constraint.HardConstraintChecker;
import org.tripweave.planning.constraint.ItineraryRepairer;
import org.tripweave.planning.constraint.RepairReport;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.score.ItineraryScorer;
import org.tripweave.planning.score.ScoreResult;
import org.tripweave.planning.search.LocalSearchOptimizer;
import org.tripweave.planning.search.OptimizationResult;

import java.util.List;

/**
 * Planning entry point composing construction, local search and the optional post-passes.
 *
 * <p>Pipeline: optimize, then repair hard ceilings (when requested), then balance
 * indoor/outdoor days (when requested), then re-score and re-check the result.
 * Each call owns its itinerary; the planner itself holds no per-request state.</p>
 */
@Slf4j
public final class ItineraryPlanner {
    public static final String REASON_REQUEST_REQUIRED = "PLAN_REQUEST_REQUIRED";
    public static final String REASON_CITY_REQUIRED = "PLAN_CITY_REQUIRED";

    private final PartitionStrategyRegistry partitionStrategies;
    private final ItineraryScorer scorer;
    private final IndoorOutdoorBalancer balancer;

    public ItineraryPlanner() {
        this.partitionStrategies = PartitionStrategyRegistry.defaultRegistry();
        this.scorer = new ItineraryScorer();
        this.balancer = new IndoorOutdoorBalancer();
    }

    /**
     * Plans one request.
     *
     * @throws PlanningException on contract violations (missing request or city, non-positive
     *         day count, negative trials, invalid score config, unknown partition strategy).
     */
    public PlanResult plan(PlanRequest request) {
        validate(request);
        PartitionStrategy partitionStrategy = partitionStrategies.require(request.getPartitionStrategyId());

        LocalSearchOptimizer optimizer = new LocalSearchOptimizer(
                partitionStrategy,
                scorer,
                request.getOptimizerConfig()
        );
        OptimizationResult optimized = optimizer.optimize(
                request.getCity(),
                request.getSpots(),
                request.getDayCount(),
                request.getScoreConfig(),
                request.getTransportMode()
        );

        Itinerary itinerary = optimized.getItinerary().copy();
        HardConstraintChecker checker = new HardConstraintChecker(request.getHardLimits());

        PlanResult.PlanResultBuilder result = PlanResult.builder()
                .transportMode(request.getTransportMode())
                .optimizerScore(optimized.score())
                .trialsRun(optimized.getTrialsRun());

        if (request.isRepairHardConstraints()) {
            RepairReport repair = new ItineraryRepairer(checker).repair(itinerary, request.getTransportMode());
            if (!repair.isComplete()) {
                log.warn("repair for '{}' dropped {} spot(s)", request.getCity(), repair.getDroppedSpots().size());
            }
            result.repairReport(repair);
        }
        if (request.isBalanceIndoorOutdoor()) {
            result.balancedDays(balancer.rebalanceAllOutdoorDays(itinerary));
        }

        ScoreResult finalScore = scorer.score(itinerary, request.getScoreConfig(), request.getTransportMode());
        List<DailyBudgetViolation> remaining = checker.check(itinerary, request.getTransportMode());
        return result
                .itinerary(itinerary)
                .finalScore(finalScore)
                .remainingViolations(remaining)
                .build();
    }

    private static void validate(PlanRequest request) {
        if (request == null) {
            throw new PlanningException(REASON_REQUEST_REQUIRED, "plan request must be provided");
        }
        if (request.getCity() == null || request.getCity().isBlank()) {
            throw new PlanningException(REASON_CITY_REQUIRED, "city must be non-blank");
        }
        InitialItineraryBuilder.requirePositiveDayCount(request.getDayCount());
    }
}
