package com.synclab.laddersim.engine.force;

public enum ForceValue {
    ON(true),
    OFF(false);

    private final boolean value;

    ForceValue(boolean value) {
        this.value = value;
    }

    public boolean booleanValue() {
        return value;
    }

    public static ForceValue of(boolean value) {
        return value ? ON : OFF;
    }

    /** Accepts {@code on/off}, {@code true/false} and {@code 1/0}, case-insensitive. */
    public static ForceValue parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("force value is required");
        }
        switch (text.trim().toLowerCase()) {
            case "on":
            case "true":
            case "1":
                return ON;
            case "off":
            case "false":
            case "0":
                return OFF;
            default:
                throw new IllegalArgumentException("Unsupported force value '" + text + "'");
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
