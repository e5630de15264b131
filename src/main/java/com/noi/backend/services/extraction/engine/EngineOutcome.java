package com.noi.backend.services.extraction.engine;

import java.util.List;

import com.noi.backend.services.extraction.model.ExtractionAttempt;
import com.noi.backend.services.extraction.model.ParsedRecord;

/**
 * What the engine produced.
 *
 * @param accepted         the first acceptable parse, or null when every attempt was rejected
 * @param transportFailure set when the model could not be reached on the final attempt
 */
public record EngineOutcome(ParsedRecord accepted, List<ExtractionAttempt> attempts, int modelCalls,
        boolean modelUnavailable, boolean cancelled, String transportFailure) {

    public static EngineOutcome unavailable() {
        return new EngineOutcome(null, List.of(), 0, true, false, null);
    }

    public boolean isAccepted() {
        return accepted != null;
    }
}
