package com.unb.negotiation.model;

/**
 * Progress measured in rounds. Immutable; {@link #advance()} yields the next round's progress.
 */
public class ProgressRounds implements Progress {
    private final int totalRounds;
    private final int currentRound;

    public ProgressRounds(int totalRounds) {
        this(totalRounds, 0);
    }

    private ProgressRounds(int totalRounds, int currentRound) {
        if (totalRounds <= 0) {
            throw new IllegalArgumentException("Total rounds must be positive, got " + totalRounds);
        }
        this.totalRounds = totalRounds;
        this.currentRound = Math.min(currentRound, totalRounds);
    }

    /**
     * @return progress after one more round, capped at the deadline
     */
    public ProgressRounds advance() {
        return new ProgressRounds(totalRounds, currentRound + 1);
    }

    /** Rounds ignore the clock. */
    @Override
    public double get(long currentTimeMillis) {
        return (double) currentRound / totalRounds;
    }

    @Override
    public String toString() {
        return "ProgressRounds[" + currentRound + "/" + totalRounds + "]";
    }
}
