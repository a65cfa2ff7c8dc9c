package com.unb.negotiation.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Utility space in which a bid's utility is the weighted sum of per-issue value utilities.
 *
 * <p>Weights must be non-negative and sum to 1; value utilities must lie in {@code [0, 1]}.
 * Under those conditions every bid utility is in {@code [0, 1]}. An optional reservation
 * bid marks the outcome the party obtains without agreement.</p>
 */
public class LinearAdditiveUtilitySpace implements UtilitySpace {
    private static final double WEIGHT_TOLERANCE = 1e-6;

    private final String name;
    private final Domain domain;
    private final Map<String, Double> issueWeights;
    private final Map<String, Map<String, Double>> valueUtilities;
    private final Bid reservationBid;

    /**
     * Create a utility space.
     *
     * @param name           profile name
     * @param domain         domain the profile applies to
     * @param issueWeights   weight per issue, summing to 1
     * @param valueUtilities utility per value, per issue; values left out count as 0
     * @param reservationBid optional reservation bid, may be {@code null}
     * @throws IllegalArgumentException if weights or utilities are out of range or do not match the domain
     */
    public LinearAdditiveUtilitySpace(String name, Domain domain, Map<String, Double> issueWeights,
                                      Map<String, Map<String, Double>> valueUtilities, Bid reservationBid) {
        double sum = 0.0;
        for (String issue : domain.getIssues()) {
            Double weight = issueWeights.get(issue);
            if (weight == null || weight < 0.0) {
                throw new IllegalArgumentException("Missing or negative weight for issue '" + issue + "' in profile " + name);
            }
            sum += weight;
            Map<String, Double> utilities = valueUtilities.getOrDefault(issue, Collections.emptyMap());
            for (Map.Entry<String, Double> entry : utilities.entrySet()) {
                if (!domain.getValues(issue).contains(entry.getKey())) {
                    throw new IllegalArgumentException("Value '" + entry.getKey() + "' is not part of issue '" + issue + "'");
                }
                if (entry.getValue() < 0.0 || entry.getValue() > 1.0) {
                    throw new IllegalArgumentException("Utility of " + issue + "=" + entry.getKey() + " outside [0,1]: " + entry.getValue());
                }
            }
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Issue weights of profile " + name + " sum to " + sum + ", expected 1");
        }
        if (reservationBid != null && !domain.isComplete(reservationBid)) {
            throw new IllegalArgumentException("Reservation bid " + reservationBid + " is not a complete bid of " + domain.getName());
        }

        this.name = name;
        this.domain = domain;
        this.issueWeights = Collections.unmodifiableMap(new HashMap<>(issueWeights));
        Map<String, Map<String, Double>> copy = new HashMap<>();
        for (Map.Entry<String, Map<String, Double>> entry : valueUtilities.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new HashMap<>(entry.getValue())));
        }
        this.valueUtilities = Collections.unmodifiableMap(copy);
        this.reservationBid = reservationBid;
    }

    @Override
    public Domain getDomain() {
        return domain;
    }

    @Override
    public Bid getReservationBid() {
        return reservationBid;
    }

    @Override
    public double getUtility(Bid bid) {
        double total = 0.0;
        for (String issue : domain.getIssues()) {
            Map<String, Double> utilities = valueUtilities.get(issue);
            if (utilities == null) continue;
            total += issueWeights.get(issue) * utilities.getOrDefault(bid.getValue(issue), 0.0);
        }
        return Math.max(0.0, Math.min(1.0, total));
    }

    @Override
    public String toString() {
        return "LinearAdditiveUtilitySpace[" + name + "]";
    }
}
