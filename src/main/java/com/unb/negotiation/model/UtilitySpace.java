package com.unb.negotiation.model;

/**
 * A party's own preferences over the bids of a domain.
 *
 * <p>Implementations are pure: the same bid always yields the same utility and querying
 * has no side effects.</p>
 */
public interface UtilitySpace {

    Domain getDomain();

    /**
     * @param bid a complete bid over {@link #getDomain()}
     * @return utility in {@code [0, 1]}
     */
    double getUtility(Bid bid);

    /**
     * @return the bid this party falls back to without agreement, or {@code null} if it has none
     */
    default Bid getReservationBid() {
        return null;
    }
}
