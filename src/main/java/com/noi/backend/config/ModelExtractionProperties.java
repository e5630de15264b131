package com.noi.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Retry budget, backoff and rate limit for model calls ("extraction.model").
 */
@Data
@Component
@ConfigurationProperties(prefix = "extraction.model")
public class ModelExtractionProperties {

    private int maxAttempts = 3;

    private long baseDelayMs = 1000;

    private long maxDelayMs = 8000;

    private int callTimeoutSeconds = 60;

    /**
     * Process-wide cap shared by every document in flight.
     */
    private int requestsPerMinute = 30;

    /**
     * Longer prompt-ready text keeps its head and tail only.
     */
    private int maxPromptChars = 12000;

    /**
     * Delay before retry number {@code attempt + 1}: base * 2^(attempt-1), capped.
     */
    public long backoffFor(int attempt) {
        if (attempt < 1 || baseDelayMs <= 0) return 0;
        long delay = baseDelayMs;
        for (int i = 1; i < attempt && delay < maxDelayMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxDelayMs);
    }

    public String getDescription() {
        return String.format(
                "ModelExtractionProperties{attempts=%d, baseDelay=%dms, maxDelay=%dms, timeout=%ds, rpm=%d, maxPrompt=%d}",
                maxAttempts, baseDelayMs, maxDelayMs, callTimeoutSeconds, requestsPerMinute, maxPromptChars);
    }
}
