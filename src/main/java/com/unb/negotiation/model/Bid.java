package com.unb.negotiation.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A bid: one value per issue.
 *
 * <p>Immutable value object. Two bids are equal when they assign the same value to the
 * same issues; issue ordering does not matter.</p>
 */
public final class Bid implements Serializable {
    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, String> values;

    public Bid(Map<String, String> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public Set<String> getIssues() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * @param issue issue name
     * @return the value assigned to the issue, or {@code null} if the bid does not contain it
     */
    public String getValue(String issue) {
        return values.get(issue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bid)) return false;
        return values.equals(((Bid) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Bid" + values;
    }
}
