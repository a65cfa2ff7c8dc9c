package com.unb.negotiation.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Index-addressable view of every bid in a {@link Domain}.
 *
 * <p>The space is never materialised. Index {@code i} is decoded as a mixed-radix number
 * whose digits select one value per issue; the last issue in domain order varies fastest.</p>
 */
public class BidSpace {
    private final Domain domain;
    private final BigInteger size;

    public BidSpace(Domain domain) {
        this.domain = domain;
        this.size = domain.size();
    }

    public Domain getDomain() {
        return domain;
    }

    public BigInteger size() {
        return size;
    }

    /**
     * Materialise the bid at a position of the space.
     *
     * @param index position in {@code [0, size)}
     * @return the bid at that position
     * @throws IndexOutOfBoundsException if the index lies outside the space
     */
    public Bid get(BigInteger index) {
        if (index.signum() < 0 || index.compareTo(size) >= 0) {
            throw new IndexOutOfBoundsException("Bid index " + index + " outside [0, " + size + ")");
        }
        List<String> issues = new ArrayList<>(domain.getIssues());
        Map<String, String> assignment = new LinkedHashMap<>();
        BigInteger remaining = index;
        for (int i = issues.size() - 1; i >= 0; i--) {
            List<String> values = domain.getValues(issues.get(i));
            BigInteger[] qr = remaining.divideAndRemainder(BigInteger.valueOf(values.size()));
            assignment.put(issues.get(i), values.get(qr[1].intValue()));
            remaining = qr[0];
        }
        // restore domain order
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String issue : issues) {
            ordered.put(issue, assignment.get(issue));
        }
        return new Bid(ordered);
    }

    public Bid get(long index) {
        return get(BigInteger.valueOf(index));
    }

    /**
     * Uniform random index in {@code [0, size)}.
     *
     * @param random random source
     * @return random index
     */
    public BigInteger randomIndex(Random random) {
        BigInteger candidate;
        do {
            candidate = new BigInteger(size.bitLength(), random);
        } while (candidate.compareTo(size) >= 0);
        return candidate;
    }

    /**
     * Uniform random bid over the whole space.
     *
     * @param random random source
     * @return random bid
     */
    public Bid randomBid(Random random) {
        return get(randomIndex(random));
    }

    /**
     * Draw up to {@code maxCount} distinct indices uniformly, without replacement.
     *
     * <p>When the space holds no more than {@code maxCount} bids every index is returned in a
     * random order.</p>
     *
     * @param maxCount upper bound on the number of indices, at least 1
     * @param random   random source
     * @return list of {@code min(maxCount, size)} distinct indices
     */
    public List<BigInteger> sampleDistinctIndices(int maxCount, Random random) {
        if (maxCount < 1) {
            throw new IllegalArgumentException("Sample size must be at least 1, got " + maxCount);
        }
        if (size.compareTo(BigInteger.valueOf(maxCount)) <= 0) {
            List<BigInteger> all = new ArrayList<>();
            for (long i = 0; i < size.longValue(); i++) {
                all.add(BigInteger.valueOf(i));
            }
            Collections.shuffle(all, random);
            return all;
        }
        // size > maxCount, so rejection of duplicates terminates
        Set<BigInteger> picked = new LinkedHashSet<>();
        while (picked.size() < maxCount) {
            picked.add(randomIndex(random));
        }
        return new ArrayList<>(picked);
    }
}
