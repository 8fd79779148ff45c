package org.tripweave.planning.geo;

import org.tripweave.planning.model.Spot;

import java.util.List;
import java.util.Objects;

/**
 * Cost contract for travelling between consecutive spots of a route.
 *
 * <p>Implementations are immutable and stateless. The distance model is used whenever
 * the transport mode is unknown; otherwise costs are expressed in minutes for the mode.</p>
 */
public interface TravelCostModel {

    /**
     * Cost of travelling from {@code from} to {@code to}.
     */
    double legCost(Spot from, Spot to);

    /**
     * Unit label of {@link #legCost(Spot, Spot)} values, used in reports.
     */
    String unit();

    /**
     * Sum of leg costs over consecutive pairs of the route. Empty and single-spot routes cost zero.
     */
    default double routeCost(List<Spot> route) {
        double total = 0.0d;
        for (int i = 1; i < route.size(); i++) {
            total += legCost(route.get(i - 1), route.get(i));
        }
        return total;
    }

    /**
     * Returns the kilometer distance model.
     */
    static TravelCostModel distance() {
        return DistanceCostModel.INSTANCE;
    }

    /**
     * Returns the minute-based model for {@code mode}, or the distance model when mode is null.
     */
    static TravelCostModel of(TransportMode mode) {
        if (mode == null) {
            return distance();
        }
        return TransportTimeCostModel.forMode(mode);
    }

    /**
     * Kilometers between spots.
     */
    final class DistanceCostModel implements TravelCostModel {
        private static final DistanceCostModel INSTANCE = new DistanceCostModel();

        private DistanceCostModel() {
        }

        @Override
        public double legCost(Spot from, Spot to) {
            return GeoDistance.flatDistanceKm(from, to);
        }

        @Override
        public String unit() {
            return "km";
        }
    }

    /**
     * Minutes between spots for one transport mode.
     */
    final class TransportTimeCostModel implements TravelCostModel {
        private static final TransportTimeCostModel WALK = new TransportTimeCostModel(TransportMode.WALK);
        private static final TransportTimeCostModel TRANSIT = new TransportTimeCostModel(TransportMode.TRANSIT);
        private static final TransportTimeCostModel TAXI = new TransportTimeCostModel(TransportMode.TAXI);

        private final TransportMode mode;

        private TransportTimeCostModel(TransportMode mode) {
            this.mode = mode;
        }

        static TransportTimeCostModel forMode(TransportMode mode) {
            return switch (Objects.requireNonNull(mode, "mode")) {
                case WALK -> WALK;
                case TRANSIT -> TRANSIT;
                case TAXI -> TAXI;
            };
        }

        public TransportMode mode() {
            return mode;
        }

        @Override
        public double legCost(Spot from, Spot to) {
            return mode.travelMinutes(GeoDistance.flatDistanceKm(from, to));
        }

        @Override
        public String unit() {
            return "min";
        }
    }
}
