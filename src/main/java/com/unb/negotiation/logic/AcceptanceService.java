package com.unb.negotiation.logic;

import com.unb.negotiation.model.Bid;
import com.unb.negotiation.model.UtilitySpace;

/**
 * Combined acceptance condition (AC_next or AC_time).
 *
 * <p>The opponent's last offer is accepted when it is worth more than the bid about to be
 * offered, or when progress has passed the time threshold. Nothing is accepted before the
 * opponent made an offer. Stateless.</p>
 */
public class AcceptanceService {

    public static final double DEFAULT_TIME_THRESHOLD = 0.95;

    private final UtilitySpace utilitySpace;
    private final double timeThreshold;

    /**
     * @param utilitySpace  own preferences
     * @param timeThreshold progress after which any offer is accepted
     */
    public AcceptanceService(UtilitySpace utilitySpace, double timeThreshold) {
        this.utilitySpace = utilitySpace;
        this.timeThreshold = timeThreshold;
    }

    public AcceptanceService(UtilitySpace utilitySpace) {
        this(utilitySpace, DEFAULT_TIME_THRESHOLD);
    }

    /**
     * @param myUpcomingBid bid this party would offer otherwise
     * @param opponentOffer the opponent's last offer, may be {@code null}
     * @param progress      current progress fraction
     * @return true to accept {@code opponentOffer}
     */
    public boolean accept(Bid myUpcomingBid, Bid opponentOffer, double progress) {
        if (opponentOffer == null) {
            return false;
        }
        return isBetterThanUpcomingBid(opponentOffer, myUpcomingBid) || progress > timeThreshold;
    }

    private boolean isBetterThanUpcomingBid(Bid opponentOffer, Bid myUpcomingBid) {
        return utilitySpace.getUtility(opponentOffer) > utilitySpace.getUtility(myUpcomingBid);
    }
}
