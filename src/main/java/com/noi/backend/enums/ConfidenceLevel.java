package com.noi.backend.enums;

/**
 * Qualitative bucket summarizing how far an extracted record can be trusted.
 */
public enum ConfidenceLevel {
    HIGH(0.8),
    MEDIUM(0.6),
    LOW(0.4),
    UNCERTAIN(0.0);

    private final double floor;

    ConfidenceLevel(double floor) {
        this.floor = floor;
    }

    public double getFloor() {
        return floor;
    }

    public static ConfidenceLevel fromScore(double score) {
        if (score >= HIGH.floor) return HIGH;
        if (score >= MEDIUM.floor) return MEDIUM;
        if (score >= LOW.floor) return LOW;
        return UNCERTAIN;
    }

    public boolean isAtLeast(ConfidenceLevel other) {
        return this.floor >= other.floor;
    }
}
