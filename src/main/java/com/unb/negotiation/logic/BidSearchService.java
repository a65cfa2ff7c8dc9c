package com.unb.negotiation.logic;

import com.unb.negotiation.model.Bid;
import com.unb.negotiation.model.BidSpace;
import com.unb.negotiation.model.UtilitySpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Chooses the bid to offer next.
 *
 * <p>Draws a bounded sample of distinct bids from the bid space and keeps those whose own
 * utility exceeds the utility of the opponent's last offer minus a concession margin. One of
 * the kept bids is returned at random. If none is kept, a random bid from the entire space
 * is returned, so a candidate always exists.</p>
 *
 * <p>The opponent model is not consulted here.</p>
 */
public class BidSearchService {
    private static final Logger log = LoggerFactory.getLogger(BidSearchService.class);

    public static final int DEFAULT_SAMPLE_SIZE = 500;
    public static final double DEFAULT_CONCESSION_MARGIN = 0.9;

    private final UtilitySpace utilitySpace;
    private final BidSpace bidSpace;
    private final int sampleSize;
    private final double concessionMargin;
    private final Random random;

    /**
     * @param utilitySpace     own preferences
     * @param sampleSize       maximum number of distinct bids inspected per search, at least 1
     * @param concessionMargin how far below the opponent's last offer a candidate may fall
     * @param random           random source
     */
    public BidSearchService(UtilitySpace utilitySpace, int sampleSize, double concessionMargin, Random random) {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("Sample size must be at least 1, got " + sampleSize);
        }
        this.utilitySpace = utilitySpace;
        this.bidSpace = new BidSpace(utilitySpace.getDomain());
        this.sampleSize = sampleSize;
        this.concessionMargin = concessionMargin;
        this.random = random;
    }

    public BidSearchService(UtilitySpace utilitySpace, Random random) {
        this(utilitySpace, DEFAULT_SAMPLE_SIZE, DEFAULT_CONCESSION_MARGIN, random);
    }

    /**
     * Find the bid to offer.
     *
     * @param lastReceivedBid the opponent's last offer, or {@code null} if none was received yet
     * @return a bid of the domain, never {@code null}
     */
    public Bid findBid(Bid lastReceivedBid) {
        List<Bid> sample = drawSample();

        if (lastReceivedBid == null) {
            // no baseline yet, plain random choice over the sample
            return sample.get(random.nextInt(sample.size()));
        }

        double threshold = concessionThreshold(utilitySpace.getUtility(lastReceivedBid));
        List<Bid> candidates = new ArrayList<>();
        for (Bid bid : sample) {
            if (utilitySpace.getUtility(bid) > threshold) {
                candidates.add(bid);
            }
        }

        if (candidates.isEmpty()) {
            log.debug("No sampled bid above {} among {}, falling back to the full bid space", threshold, sample.size());
            return bidSpace.randomBid(random);
        }
        log.debug("{} of {} sampled bids above threshold {}", candidates.size(), sample.size(), threshold);
        return candidates.get(random.nextInt(candidates.size()));
    }

    /**
     * Utility a candidate must exceed, given the utility of the opponent's last offer.
     *
     * @param previousOfferUtility own utility of the opponent's last offer
     * @return filter threshold
     */
    public double concessionThreshold(double previousOfferUtility) {
        return previousOfferUtility - concessionMargin;
    }

    List<Bid> drawSample() {
        List<BigInteger> indices = bidSpace.sampleDistinctIndices(sampleSize, random);
        List<Bid> sample = new ArrayList<>(indices.size());
        for (BigInteger index : indices) {
            sample.add(bidSpace.get(index));
        }
        return sample;
    }
}
