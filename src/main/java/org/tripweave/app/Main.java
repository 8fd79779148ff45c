package org.tripweave.app;

import lombok.extern.slf4j.Slf4j;
import org.tripweave.catalog.SpotCatalogLoader;
import org.tripweave.planning.core.ItineraryPlanner;
import org.tripweave.planning.core.PlanReportFormatter;
import org.tripweave.planning.core.PlanRequest;
import org.tripweave.planning.core.PlanResult;
import org.tripweave.planning.core.PlanningException;
import org.tripweave.planning.geo.TransportMode;
import org.tripweave.planning.model.Spot;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: plans a catalogue file and prints the self-check report.
 *
 * <pre>
 * Main &lt;spots.json&gt; [city] [days] [walk|transit|taxi]
 * </pre>
 */
@Slf4j
public class Main {
    static final int DEFAULT_DAYS = 3;
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 1;

    /**
     * Launches the planner.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out) {
        if (args.length < 1) {
            out.println("usage: Main <spots.json> [city] [days] [walk|transit|taxi]");
            return EXIT_USAGE;
        }
        Path catalogue = Path.of(args[0]);
        String city = args.length > 1 ? args[1] : cityFromFileName(catalogue);
        TransportMode mode;
        int days;
        try {
            days = args.length > 2 ? Integer.parseInt(args[2]) : DEFAULT_DAYS;
            mode = args.length > 3 ? TransportMode.parse(args[3]) : null;
        } catch (IllegalArgumentException ex) {
            out.println("invalid argument: " + ex.getMessage());
            return EXIT_USAGE;
        }

        try {
            List<Spot> spots = new SpotCatalogLoader().load(catalogue);
            PlanResult result = new ItineraryPlanner().plan(PlanRequest.builder()
                    .city(city)
                    .spots(spots)
                    .dayCount(days)
                    .transportMode(mode)
                    .repairHardConstraints(true)
                    .balanceIndoorOutdoor(true)
                    .build());
            for (String line : PlanReportFormatter.format(result)) {
                out.println(line);
            }
            return EXIT_OK;
        } catch (PlanningException ex) {
            log.error("planning failed ({}): {}", ex.reasonCode(), ex.getMessage(), ex);
            out.println("planning failed: " + ex.getMessage());
            return EXIT_FAILED;
        }
    }

    /**
     * Derives {@code tokyo} from {@code spots_tokyo.json}.
     */
    static String cityFromFileName(Path catalogue) {
        String fileName = catalogue.getFileName().toString();
        String base = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
        return base.startsWith("spots_") ? base.substring("spots_".length()) : base;
    }
}
