package com.synclab.laddersim.engine.fault;

import java.util.Locale;

public enum FaultType {
    STUCK_ON,
    STUCK_OFF,
    /** Reads the opposite of the real value. */
    INVERTED,
    /** Each scan the read flips with the configured probability. */
    INTERMITTENT,
    /** Reads lag the real value by the configured delay. */
    DELAYED;

    /** Accepts {@code stuck_on}, {@code STUCK-ON}, {@code stuckOn} and the like. */
    public static FaultType parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("fault type is required");
        }
        String normalized = text.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported fault type '" + text + "'", e);
        }
    }
}
