package com.unb.negotiation.model;

import java.util.Objects;

/**
 * An action performed by a party: offering a bid or accepting the bid last offered to it.
 */
public final class Action {

    /** Kinds of action a party can take on its turn. */
    public enum Kind {
        OFFER,
        ACCEPT
    }

    private final Kind kind;
    private final String actor;
    private final Bid bid;

    private Action(Kind kind, String actor, Bid bid) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.actor = Objects.requireNonNull(actor, "actor");
        this.bid = Objects.requireNonNull(bid, "bid");
    }

    public static Action offer(String actor, Bid bid) {
        return new Action(Kind.OFFER, actor, bid);
    }

    public static Action accept(String actor, Bid bid) {
        return new Action(Kind.ACCEPT, actor, bid);
    }

    public Kind getKind() {
        return kind;
    }

    public String getActor() {
        return actor;
    }

    /**
     * @return the offered bid for {@link Kind#OFFER}, the accepted bid for {@link Kind#ACCEPT}
     */
    public Bid getBid() {
        return bid;
    }

    public boolean isOffer() {
        return kind == Kind.OFFER;
    }

    public boolean isAccept() {
        return kind == Kind.ACCEPT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Action)) return false;
        Action other = (Action) o;
        return kind == other.kind && actor.equals(other.actor) && bid.equals(other.bid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, actor, bid);
    }

    @Override
    public String toString() {
        return kind + " by " + actor + ": " + bid;
    }
}
