package com.synclab.laddersim.engine.fault;

import java.util.Objects;

/**
 * One injected fault. {@code probability} applies to {@link FaultType#INTERMITTENT},
 * {@code delayMillis} to {@link FaultType#DELAYED}; both are ignored otherwise.
 */
public final class FaultConfig {

    public static final double DEFAULT_PROBABILITY = 0.5;
    public static final long DEFAULT_DELAY_MILLIS = 500L;

    private final FaultType type;
    private final double probability;
    private final long delayMillis;

    private FaultConfig(FaultType type, double probability, long delayMillis) {
        this.type = Objects.requireNonNull(type, "type");
        this.probability = probability;
        this.delayMillis = delayMillis;
    }

    public static FaultConfig of(FaultType type) {
        return new FaultConfig(type, DEFAULT_PROBABILITY, DEFAULT_DELAY_MILLIS);
    }

    public static FaultConfig intermittent(double probability) {
        if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("probability must be within [0, 1]: " + probability);
        }
        return new FaultConfig(FaultType.INTERMITTENT, probability, DEFAULT_DELAY_MILLIS);
    }

    public static FaultConfig delayed(long delayMillis) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delay must not be negative: " + delayMillis);
        }
        return new FaultConfig(FaultType.DELAYED, DEFAULT_PROBABILITY, delayMillis);
    }

    public FaultType getType() {
        return type;
    }

    public double getProbability() {
        return probability;
    }

    public long getDelayMillis() {
        return delayMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FaultConfig)) return false;
        FaultConfig that = (FaultConfig) o;
        return type == that.type
                && Double.compare(probability, that.probability) == 0
                && delayMillis == that.delayMillis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, probability, delayMillis);
    }

    @Override
    public String toString() {
        return switch (type) {
            case INTERMITTENT -> type + "(" + probability + ")";
            case DELAYED -> type + "(" + delayMillis + "ms)";
            default -> type.toString();
        };
    }
}
