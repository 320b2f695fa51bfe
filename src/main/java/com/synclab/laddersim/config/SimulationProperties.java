package com.synclab.laddersim.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ladder.simulation")
public class SimulationProperties {

    /** Period of the optional background scan loop. */
    private long scanIntervalMs = 100L;
    private long defaultTimerPresetMs = 5000L;
    private int defaultCounterPreset = 10;
    /** Cap on the length operand of COP and FLL. */
    private int maxBlockLength = 128;
    /** Seed for intermittent faults; unset picks one per session. */
    private Long faultSeed;
    private final Trend trend = new Trend();

    public long getScanIntervalMs() {
        return scanIntervalMs;
    }

    public void setScanIntervalMs(long scanIntervalMs) {
        this.scanIntervalMs = scanIntervalMs;
    }

    public long getDefaultTimerPresetMs() {
        return defaultTimerPresetMs;
    }

    public void setDefaultTimerPresetMs(long defaultTimerPresetMs) {
        this.defaultTimerPresetMs = defaultTimerPresetMs;
    }

    public int getDefaultCounterPreset() {
        return defaultCounterPreset;
    }

    public void setDefaultCounterPreset(int defaultCounterPreset) {
        this.defaultCounterPreset = defaultCounterPreset;
    }

    public int getMaxBlockLength() {
        return maxBlockLength;
    }

    public void setMaxBlockLength(int maxBlockLength) {
        this.maxBlockLength = maxBlockLength;
    }

    public Long getFaultSeed() {
        return faultSeed;
    }

    public void setFaultSeed(Long faultSeed) {
        this.faultSeed = faultSeed;
    }

    public Trend getTrend() {
        return trend;
    }

    public static class Trend {
        private int maxPoints = 600;
        private double windowSeconds = 60.0;

        public int getMaxPoints() {
            return maxPoints;
        }

        public void setMaxPoints(int maxPoints) {
            this.maxPoints = maxPoints;
        }

        public double getWindowSeconds() {
            return windowSeconds;
        }

        public void setWindowSeconds(double windowSeconds) {
            this.windowSeconds = windowSeconds;
        }
    }
}
