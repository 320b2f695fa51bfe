package com.synclab.laddersim.engine.trend;

import java.util.Objects;

public final class TrendPoint {

    private final double time;
    private final double value;

    public TrendPoint(double time, double value) {
        this.time = time;
        this.value = value;
    }

    /** Scan-relative elapsed seconds. */
    public double getTime() {
        return time;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrendPoint)) return false;
        TrendPoint that = (TrendPoint) o;
        return Double.compare(time, that.time) == 0 && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, value);
    }

    @Override
    public String toString() {
        return "(" + time + ", " + value + ")";
    }
}
