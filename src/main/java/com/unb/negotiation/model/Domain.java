package com.unb.negotiation.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static description of a negotiation domain: a name and an ordered set of issues,
 * each with a finite, ordered list of admissible values.
 *
 * <p>Instances are immutable. Issue order is the insertion order and defines the
 * addressing scheme used by {@link BidSpace}.</p>
 */
public class Domain {
    private final String name;
    private final Map<String, List<String>> issues;

    /**
     * Create a domain.
     *
     * @param name   domain name
     * @param issues ordered mapping issue name to its values; every issue needs at least one value
     * @throws IllegalArgumentException if there are no issues or an issue has no values
     */
    public Domain(String name, Map<String, List<String>> issues) {
        if (issues == null || issues.isEmpty()) {
            throw new IllegalArgumentException("Domain " + name + " must declare at least one issue");
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : issues.entrySet()) {
            List<String> values = entry.getValue();
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("Issue '" + entry.getKey() + "' has no values");
            }
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(values)));
        }
        this.name = name;
        this.issues = Collections.unmodifiableMap(copy);
    }

    /**
     * Get the domain name.
     *
     * @return domain name
     */
    public String getName() {
        return name;
    }

    /**
     * Get the issue names in domain order.
     *
     * @return unmodifiable ordered set of issue names
     */
    public Set<String> getIssues() {
        return issues.keySet();
    }

    /**
     * Get the admissible values of an issue.
     *
     * @param issue issue name
     * @return unmodifiable list of values, or {@code null} if the issue is unknown
     */
    public List<String> getValues(String issue) {
        return issues.get(issue);
    }

    /**
     * Number of distinct bids in this domain (product of all value-set sizes).
     *
     * @return size of the full bid space
     */
    public BigInteger size() {
        BigInteger size = BigInteger.ONE;
        for (List<String> values : issues.values()) {
            size = size.multiply(BigInteger.valueOf(values.size()));
        }
        return size;
    }

    /**
     * Check that a bid assigns an admissible value to every issue of this domain and nothing else.
     *
     * @param bid bid to check
     * @return true when the bid is a complete, valid assignment over this domain
     */
    public boolean isComplete(Bid bid) {
        if (bid == null || !bid.getIssues().equals(issues.keySet())) {
            return false;
        }
        for (String issue : issues.keySet()) {
            if (!issues.get(issue).contains(bid.getValue(issue))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Domain[" + name + ", " + issues + "]";
    }
}
