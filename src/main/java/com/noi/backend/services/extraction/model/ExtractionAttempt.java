package com.noi.backend.services.extraction.model;

/**
 * One call to the model and what came of it.
 *
 * @param promptId short hash of the prompt text, enough to tell two prompts apart in the audit trail
 */
public record ExtractionAttempt(int index, AttemptStrategy strategy, String promptId, String rawOutput,
        Outcome outcome, String detail, long elapsedMs) {

    public enum Outcome {
        ACCEPTED,
        ALL_ZERO,
        SCHEMA_MISMATCH,
        TIMEOUT,
        TRANSPORT_ERROR;

        public boolean isTransient() {
            return this == TIMEOUT;
        }
    }

    public boolean accepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
