package com.unb.negotiation.model;

/**
 * Progress measured against a wall-clock deadline.
 */
public class ProgressTime implements Progress {
    private final long durationMillis;
    private final long startMillis;

    /**
     * @param durationMillis length of the negotiation in milliseconds, must be positive
     * @param startMillis    wall-clock start of the negotiation
     */
    public ProgressTime(long durationMillis, long startMillis) {
        if (durationMillis <= 0) {
            throw new IllegalArgumentException("Duration must be positive, got " + durationMillis);
        }
        this.durationMillis = durationMillis;
        this.startMillis = startMillis;
    }

    @Override
    public double get(long currentTimeMillis) {
        double fraction = (double) (currentTimeMillis - startMillis) / durationMillis;
        return Math.max(0.0, Math.min(1.0, fraction));
    }

    @Override
    public String toString() {
        return "ProgressTime[" + startMillis + " + " + durationMillis + "ms]";
    }
}
