package com.unb.negotiation.model;

/**
 * Elapsed share of a negotiation's budget.
 *
 * <p>{@code 0} is the start of the negotiation and {@code 1} the deadline. The value never
 * decreases as time advances.</p>
 */
public interface Progress {

    /**
     * @param currentTimeMillis current wall-clock time in milliseconds
     * @return progress fraction in {@code [0, 1]}
     */
    double get(long currentTimeMillis);

    /**
     * @param currentTimeMillis current wall-clock time in milliseconds
     * @return true when the deadline has been reached
     */
    default boolean isPastDeadline(long currentTimeMillis) {
        return get(currentTimeMillis) >= 1.0;
    }
}
