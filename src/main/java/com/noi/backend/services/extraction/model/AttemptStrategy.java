package com.noi.backend.services.extraction.model;

/**
 * Explicitness level of one model attempt. Later attempts never resend the same prompt.
 */
public enum AttemptStrategy {
    STANDARD(0.1),
    EMPHATIC(0.0),
    WORKED_EXAMPLE(0.0);

    private final double temperature;

    AttemptStrategy(double temperature) {
        this.temperature = temperature;
    }

    public double getTemperature() {
        return temperature;
    }

    /**
     * Strategy for the 1-based attempt number; attempts past the last strategy reuse it.
     */
    public static AttemptStrategy forAttempt(int attempt) {
        AttemptStrategy[] all = values();
        int idx = Math.max(0, Math.min(attempt - 1, all.length - 1));
        return all[idx];
    }
}
