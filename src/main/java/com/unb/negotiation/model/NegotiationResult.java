package com.unb.negotiation.model;

import java.io.Serializable;

/**
 * Outcome of one bilateral session.
 */
public class NegotiationResult implements Serializable {
    private static final long serialVersionUID = 1L;

    private final Bid agreement;
    private final int turns;
    private final String firstParty;
    private final String secondParty;
    private final double firstUtility;
    private final double secondUtility;

    public NegotiationResult(Bid agreement, int turns, String firstParty, String secondParty,
                             double firstUtility, double secondUtility) {
        this.agreement = agreement;
        this.turns = turns;
        this.firstParty = firstParty;
        this.secondParty = secondParty;
        this.firstUtility = firstUtility;
        this.secondUtility = secondUtility;
    }

    /** @return the agreed bid, or {@code null} when the deadline passed without agreement */
    public Bid getAgreement() { return agreement; }
    public boolean isAgreement() { return agreement != null; }
    public int getTurns() { return turns; }
    public String getFirstParty() { return firstParty; }
    public String getSecondParty() { return secondParty; }
    /** @return utility of the agreement for the first party; without agreement, of its reservation bid (0 if none) */
    public double getFirstUtility() { return firstUtility; }
    /** @return utility of the agreement for the second party; without agreement, of its reservation bid (0 if none) */
    public double getSecondUtility() { return secondUtility; }

    @Override
    public String toString() {
        if (agreement == null) {
            return String.format("No agreement between %s and %s after %d turns", firstParty, secondParty, turns);
        }
        return String.format("Agreement %s after %d turns (%s: %.3f, %s: %.3f)",
                agreement, turns, firstParty, firstUtility, secondParty, secondUtility);
    }
}
