package com.unb.negotiation.logic;

import com.unb.negotiation.model.Bid;
import com.unb.negotiation.model.Domain;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Frequency-based estimate of the opponent's preferences.
 *
 * <p>Counts how often the opponent offered each value of each issue. A value offered more
 * often is assumed to be preferred. The predicted utility of a bid is the mean over all
 * issues of its value's relative frequency within that issue. Issues are equally weighted;
 * an issue with no observations contributes {@code 1 / |values|}.</p>
 *
 * <p>Counts only grow for the lifetime of the instance.</p>
 */
public class FrequencyOpponentModel {
    private final Domain domain;
    private final Map<String, Map<String, Integer>> valueCounts = new HashMap<>();
    private final Map<String, Integer> issueTotals = new HashMap<>();
    private int observations = 0;

    public FrequencyOpponentModel(Domain domain) {
        this.domain = domain;
        for (String issue : domain.getIssues()) {
            valueCounts.put(issue, new HashMap<>());
            issueTotals.put(issue, 0);
        }
    }

    /**
     * Record one opponent offer.
     *
     * @param bid bid offered by the opponent
     */
    public void update(Bid bid) {
        for (String issue : domain.getIssues()) {
            String value = bid.getValue(issue);
            if (value == null) continue;
            valueCounts.get(issue).merge(value, 1, Integer::sum);
            issueTotals.merge(issue, 1, Integer::sum);
        }
        observations++;
    }

    /**
     * Predicted utility of a bid for the opponent.
     *
     * @param bid bid to evaluate
     * @return value in {@code [0, 1]}
     */
    public double getPredictedUtility(Bid bid) {
        double sum = 0.0;
        for (String issue : domain.getIssues()) {
            sum += normalizedFrequency(issue, bid.getValue(issue));
        }
        return sum / domain.getIssues().size();
    }

    private double normalizedFrequency(String issue, String value) {
        int total = issueTotals.get(issue);
        if (total == 0) {
            List<String> values = domain.getValues(issue);
            return 1.0 / values.size();
        }
        return (double) getCount(issue, value) / total;
    }

    /**
     * @return how often the opponent offered {@code value} for {@code issue}
     */
    public int getCount(String issue, String value) {
        Map<String, Integer> counts = valueCounts.get(issue);
        return counts == null ? 0 : counts.getOrDefault(value, 0);
    }

    /**
     * @return number of observations recorded for {@code issue}
     */
    public int getTotal(String issue) {
        return issueTotals.getOrDefault(issue, 0);
    }

    /**
     * @return number of bids passed to {@link #update(Bid)}
     */
    public int getObservationCount() {
        return observations;
    }

    public Domain getDomain() {
        return domain;
    }
}
