package com.unb.negotiation.model;

import java.util.Objects;

/**
 * Notification delivered to a party by the turn protocol.
 *
 * <p>Exactly three kinds exist. Handlers switch on {@link #getKind()}; only
 * {@link Kind#ACTION_DONE} carries an action.</p>
 */
public final class Inform {

    /** The three turn-protocol events. */
    public enum Kind {
        /** Some party, possibly the receiver itself, performed an action. */
        ACTION_DONE,
        /** The receiver must answer with exactly one action. */
        YOUR_TURN,
        /** The session ended through agreement or deadline; no further actions are expected. */
        FINISHED
    }

    private static final Inform YOUR_TURN = new Inform(Kind.YOUR_TURN, null, null);

    private final Kind kind;
    private final Action action;
    private final Bid agreement;

    private Inform(Kind kind, Action action, Bid agreement) {
        this.kind = kind;
        this.action = action;
        this.agreement = agreement;
    }

    public static Inform actionDone(Action action) {
        return new Inform(Kind.ACTION_DONE, Objects.requireNonNull(action, "action"), null);
    }

    public static Inform yourTurn() {
        return YOUR_TURN;
    }

    /**
     * @param agreement the agreed bid, or {@code null} if the session ended without agreement
     * @return a finished notification
     */
    public static Inform finished(Bid agreement) {
        return new Inform(Kind.FINISHED, null, agreement);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the performed action for {@link Kind#ACTION_DONE}, otherwise {@code null}
     */
    public Action getAction() {
        return action;
    }

    /**
     * @return the agreed bid for a {@link Kind#FINISHED} notification that ended in agreement, otherwise {@code null}
     */
    public Bid getAgreement() {
        return agreement;
    }

    @Override
    public String toString() {
        switch (kind) {
            case ACTION_DONE:
                return "ActionDone[" + action + "]";
            case FINISHED:
                return "Finished[" + (agreement == null ? "no agreement" : agreement) + "]";
            default:
                return "YourTurn";
        }
    }
}
