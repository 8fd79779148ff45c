package org.tripweave.planning.search;

import org.tripweave.planning.model.Itinerary;

import java.util.Random;

/**
 * In-place neighbourhood move over a candidate itinerary.
 *
 * <p>Implementations must keep every spot in exactly one day. They are applied to a
 * private copy of the current state, never to the retained current/best itineraries.</p>
 */
public interface MutationOperator {

    /**
     * Stable operator identifier used in logs.
     */
    String id();

    /**
     * Applies one random move.
     *
     * @param candidate itinerary to mutate in place.
     * @param random seeded random stream owned by the search run.
     * @return false when no eligible day exists; the candidate is then unchanged.
     */
    boolean mutate(Itinerary candidate, Random random);
}
