package org.tripweave.planning.core;

import lombok.experimental.UtilityClass;
import org.tripweave.planning.constraint.DailyBudgetViolation;
import org.tripweave.planning.model.DayPlan;
import org.tripweave.planning.model.Spot;
import org.tripweave.planning.score.ScoreResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a plan as the plain-text self-check report.
 */
@UtilityClass
public final class PlanReportFormatter {

    /**
     * Report lines: best score, penalty reasons, one line per day, then repair/balance notes.
     */
    public static List<String> format(PlanResult result) {
        List<String> lines = new ArrayList<>();
        ScoreResult score = result.getFinalScore();
        lines.add(String.format(Locale.ROOT, "Best score: %.2f", score.getScore()));
        if (score.getReasons().isEmpty()) {
            lines.add("Self-check report: no penalties");
        } else {
            lines.add("Self-check report:");
            for (String reason : score.getReasons()) {
                lines.add(" - " + reason);
            }
        }

        List<DayPlan> days = result.getItinerary().days();
        for (int i = 0; i < days.size(); i++) {
            DayPlan day = days.get(i);
            String route = day.spots().stream().map(Spot::name).collect(Collectors.joining(" -> "));
            lines.add(String.format(
                    Locale.ROOT,
                    "Day %d (%.2f %s): %s",
                    day.day(),
                    score.getDayCosts().get(i),
                    score.getUnit(),
                    route.isEmpty() ? "(free day)" : route
            ));
        }

        if (result.getRepairReport() != null) {
            for (Spot dropped : result.getRepairReport().getDroppedSpots()) {
                lines.add("Unplaced after repair: " + dropped.name());
            }
        }
        for (Integer balancedDay : result.getBalancedDays()) {
            lines.add("Day " + balancedDay + ": swapped in an indoor spot");
        }
        for (DailyBudgetViolation violation : result.getRemainingViolations()) {
            lines.add(String.format(
                    Locale.ROOT,
                    "Day %d: over hard limit (%.1f > %.1f)",
                    violation.getDay(),
                    violation.getMeasured(),
                    violation.getLimit()
            ));
        }
        return lines;
    }
}
