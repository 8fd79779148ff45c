package org.tripweave.planning.search;

import lombok.extern.slf4j.Slf4j;
import org.tripweave.planning.construct.InitialItineraryBuilder;
import org.tripweave.planning.construct.NearestNeighborRouter;
import org.tripweave.planning.construct.PartitionStrategy;
import org.tripweave.planning.construct.PartitionStrategyRegistry;
import org.tripweave.planning.geo.TransportMode;
import org.tripweave.planning.geo.TravelCostModel;
import org.tripweave.planning.model.Itinerary;
import org.tripweave.planning.model.Spot;
import org.tripweave.planning.score.ItineraryScorer;
import org.tripweave.planning.score.ScoreConfig;
import org.tripweave.planning.score.ScoreResult;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Stochastic local search over day assignments with a fixed trial budget.
 *
 * <p>Each trial copies the current state, applies the move operator with probability
 * {@link OptimizerConfig#getMoveProbability()} (swap otherwise), scores the copy and asks
 * the {@link AcceptancePolicy} whether it becomes current. The best state is replaced
 * only on strict improvement. The random stream is seeded per run, so identical inputs
 * produce identical results. The loop never checks wall-clock time; bound the trial
 * count to bound latency.</p>
 */
@Slf4j
public final class LocalSearchOptimizer {
    private final PartitionStrategy partitionStrategy;
    private final ItineraryScorer scorer;
    private final OptimizerConfig config;

    public LocalSearchOptimizer(PartitionStrategy partitionStrategy, ItineraryScorer scorer, OptimizerConfig config) {
        this.partitionStrategy = Objects.requireNonNull(partitionStrategy, "partitionStrategy");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
    }

    /**
     * Optimizer with round-robin construction and the given config.
     */
    public static LocalSearchOptimizer withConfig(OptimizerConfig config) {
        return new LocalSearchOptimizer(
                PartitionStrategyRegistry.defaultRegistry().defaultStrategy(),
                new ItineraryScorer(),
                config
        );
    }

    public OptimizerConfig config() {
        return config;
    }

    /**
     * Optimizes with distance-based costing.
     */
    public OptimizationResult optimize(String city, List<Spot> spots, int dayCount, ScoreConfig scoreConfig) {
        return optimize(city, spots, dayCount, scoreConfig, null);
    }

    /**
     * Optimizes with time-based costing for {@code mode}, or distance-based costing when mode is null.
     *
     * @throws org.tripweave.planning.core.PlanningException on a non-positive day count or an
     *         invalid score configuration.
     */
    public OptimizationResult optimize(
            String city,
            List<Spot> spots,
            int dayCount,
            ScoreConfig scoreConfig,
            TransportMode mode
    ) {
        Objects.requireNonNull(scoreConfig, "scoreConfig");
        scoreConfig.validate();

        NearestNeighborRouter router = new NearestNeighborRouter(TravelCostModel.of(mode));
        InitialItineraryBuilder builder = new InitialItineraryBuilder(partitionStrategy, router);
        MutationOperator move = new MoveSpotMutation(router);
        MutationOperator swap = new SwapSpotMutation(router);
        AcceptancePolicy acceptance = config.getAcceptancePolicy();
        int trials = config.getTrials();
        Random random = new Random(config.getSeed());

        Itinerary current = builder.build(city, spots, dayCount);
        ScoreResult currentScore = scorer.score(current, scoreConfig, mode);
        Itinerary best = current;
        ScoreResult bestScore = currentScore;
        double initialScore = currentScore.getScore();

        int accepted = 0;
        int improvements = 0;
        int noOps = 0;
        for (int trial = 0; trial < trials; trial++) {
            Itinerary candidate = current.copy();
            MutationOperator operator = random.nextDouble() < config.getMoveProbability() ? move : swap;
            if (!operator.mutate(candidate, random)) {
                noOps++;
                continue;
            }
            ScoreResult candidateScore = scorer.score(candidate, scoreConfig, mode);

            if (acceptance.accept(
                    candidateScore.getScore(),
                    currentScore.getScore(),
                    bestScore.getScore(),
                    trial,
                    trials,
                    random
            )) {
                current = candidate;
                currentScore = candidateScore;
                accepted++;
            }
            if (candidateScore.getScore() < bestScore.getScore()) {
                log.debug(
                        "trial {} ({}): best score {} -> {}",
                        trial, operator.id(), bestScore.getScore(), candidateScore.getScore()
                );
                best = candidate;
                bestScore = candidateScore;
                improvements++;
            }
        }

        log.info(
                "optimized {} spots over {} days for '{}': trials={}, accepted={}, improvements={}, noOps={}, score {} -> {}",
                spots.size(), dayCount, city, trials, accepted, improvements, noOps, initialScore, bestScore.getScore()
        );

        return OptimizationResult.builder()
                .itinerary(best)
                .scoreResult(bestScore)
                .initialScore(initialScore)
                .trialsRun(trials)
                .acceptedMoves(accepted)
                .improvements(improvements)
                .noOpTrials(noOps)
                .build();
    }
}
