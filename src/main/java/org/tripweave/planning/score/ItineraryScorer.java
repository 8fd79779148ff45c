package org.tripweave.planning.score;

import org.tripweave.planning.geo.TransportMode;
import org.tripweave.planning.geo.TravelCostModel;
import org.tripweave.planning.model.DayPlan;
import org.tripweave.planning.model.Itinerary;

import java.util.Locale;
import java.util.Objects;

/**
 * Soft-constraint scorer. Lower scores are better.
 *
 * <p>Per day the raw route cost is added to the score (prefer shorter days), plus
 * {@code excess * penalty} when the day exceeds its budget. When the itinerary holds
 * enough spots for every day to reach {@link ScoreConfig#getMinSpotsPerDay()}, each
 * sparser day adds the flat sparse-day penalty.</p>
 *
 * <p>Stateless and side-effect free: the itinerary is only read.</p>
 */
public final class ItineraryScorer {

    /**
     * Scores with the kilometer budget.
     */
    public ScoreResult score(Itinerary itinerary, ScoreConfig config) {
        return score(itinerary, config, null);
    }

    /**
     * Scores with the minute budget of {@code mode}, or the kilometer budget when mode is null.
     */
    public ScoreResult score(Itinerary itinerary, ScoreConfig config, TransportMode mode) {
        Objects.requireNonNull(itinerary, "itinerary");
        Objects.requireNonNull(config, "config");
        config.validate();

        TravelCostModel costModel = TravelCostModel.of(mode);
        double budget;
        double exceedPenalty;
        if (mode == null) {
            budget = config.getMaxDailyKm();
            exceedPenalty = config.getExceedKmPenalty();
        } else {
            budget = config.maxDailyMinutes(mode);
            exceedPenalty = config.getExceedMinutePenalty();
        }

        int dayCount = itinerary.dayCount();
        boolean expectMinimum = itinerary.totalSpotCount() >= (long) dayCount * config.getMinSpotsPerDay();

        ScoreResult.ScoreResultBuilder result = ScoreResult.builder().unit(costModel.unit());
        double score = 0.0d;
        for (DayPlan day : itinerary.days()) {
            double dayCost = day.totalCost(costModel);
            result.dayCost(dayCost);
            score += dayCost;

            if (dayCost > budget) {
                double excess = dayCost - budget;
                double penalty = excess * exceedPenalty;
                score += penalty;
                result.reason(exceededReason(day.day(), budget, excess, penalty, mode));
            }

            if (expectMinimum && day.size() < config.getMinSpotsPerDay()) {
                score += config.getOneSpotDayPenalty();
                result.reason(String.format(
                        Locale.ROOT,
                        "Day %d: only %d spot(s) (+%.2f)",
                        day.day(),
                        day.size(),
                        config.getOneSpotDayPenalty()
                ));
            }
        }
        return result.score(score).build();
    }

    private static String exceededReason(int day, double budget, double excess, double penalty, TransportMode mode) {
        if (mode == null) {
            return String.format(
                    Locale.ROOT,
                    "Day %d: exceeded %.1fkm by %.2fkm (+%.2f)",
                    day, budget, excess, penalty
            );
        }
        return String.format(
                Locale.ROOT,
                "Day %d: exceeded %.0f min (%s) by %.1f min (+%.2f)",
                day, budget, mode.name().toLowerCase(Locale.ROOT), excess, penalty
        );
    }
}
