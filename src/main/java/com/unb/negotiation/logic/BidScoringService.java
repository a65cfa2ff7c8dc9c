package com.unb.negotiation.logic;

import com.unb.negotiation.model.Bid;
import com.unb.negotiation.model.UtilitySpace;

/**
 * Heuristic score of a bid that blends own utility, time pressure and the opponent's
 * predicted utility.
 *
 * <pre>
 *   tp    = 1 - progress^(1/eps)
 *   score = alpha * tp * u(bid) + (1 - alpha * tp) * opp(bid)
 * </pre>
 *
 * The opponent term is left out when no opponent model exists yet. A small {@code eps}
 * keeps {@code tp} close to 1 for most of the session and drops it abruptly near the
 * deadline (Boulware behaviour).
 */
public class BidScoringService {

    public static final double DEFAULT_ALPHA = 0.95;
    public static final double DEFAULT_EPS = 0.1;

    private final UtilitySpace utilitySpace;
    private final double alpha;
    private final double eps;

    /**
     * @param utilitySpace own preferences
     * @param alpha        trade-off between self-interested and altruistic behaviour
     * @param eps          time pressure factor, must be positive
     */
    public BidScoringService(UtilitySpace utilitySpace, double alpha, double eps) {
        if (eps <= 0.0) {
            throw new IllegalArgumentException("eps must be positive, got " + eps);
        }
        this.utilitySpace = utilitySpace;
        this.alpha = alpha;
        this.eps = eps;
    }

    public BidScoringService(UtilitySpace utilitySpace) {
        this(utilitySpace, DEFAULT_ALPHA, DEFAULT_EPS);
    }

    /**
     * Time pressure at a given progress.
     *
     * @param progress progress fraction in {@code [0, 1]}
     * @return {@code 1 - progress^(1/eps)}
     */
    public double timePressure(double progress) {
        return 1.0 - Math.pow(progress, 1.0 / eps);
    }

    /**
     * Score a bid.
     *
     * @param bid           bid to score
     * @param progress      current progress fraction
     * @param opponentModel opponent model, or {@code null} when no opponent offer was seen
     * @return heuristic score, higher is better
     */
    public double scoreBid(Bid bid, double progress, FrequencyOpponentModel opponentModel) {
        double timePressure = timePressure(progress);
        double score = alpha * timePressure * utilitySpace.getUtility(bid);

        if (opponentModel != null) {
            score += (1.0 - alpha * timePressure) * opponentModel.getPredictedUtility(bid);
        }
        return score;
    }
}
