package com.synclab.laddersim.engine.trend;

/**
 * How much history a trend keeps. A limit of zero or less disables that limit; with both
 * disabled nothing is evicted.
 */
public final class RetentionPolicy {

    private final int maxPoints;
    private final double windowSeconds;

    private RetentionPolicy(int maxPoints, double windowSeconds) {
        this.maxPoints = maxPoints;
        this.windowSeconds = windowSeconds;
    }

    public static RetentionPolicy of(int maxPoints, double windowSeconds) {
        return new RetentionPolicy(maxPoints, windowSeconds);
    }

    public static RetentionPolicy maxPoints(int maxPoints) {
        return new RetentionPolicy(maxPoints, 0.0);
    }

    public static RetentionPolicy window(double windowSeconds) {
        return new RetentionPolicy(0, windowSeconds);
    }

    public static RetentionPolicy unbounded() {
        return new RetentionPolicy(0, 0.0);
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    public double getWindowSeconds() {
        return windowSeconds;
    }

    boolean hasPointLimit() {
        return maxPoints > 0;
    }

    boolean hasWindow() {
        return windowSeconds > 0.0;
    }

    @Override
    public String toString() {
        return "RetentionPolicy{maxPoints=" + maxPoints + ", windowSeconds=" + windowSeconds + "}";
    }
}
