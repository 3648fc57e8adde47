package io.liveguard.model;

/**
 * Red/yellow/green trust tier. The multiplier feeds the quality score and is strictly
 * ordered green &gt; yellow &gt; red.
 */
public enum Confidence {
    GREEN("green", 1.0),
    YELLOW("yellow", 0.7),
    RED("red", 0.3);

    private final String wire;
    private final double multiplier;

    Confidence(String wire, double multiplier) {
        this.wire = wire;
        this.multiplier = multiplier;
    }

    public String wire() {
        return wire;
    }

    public double multiplier() {
        return multiplier;
    }

    public static Confidence fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return RED;
        }
        for (Confidence value : values()) {
            if (value.wire.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown confidence: " + raw);
    }
}
