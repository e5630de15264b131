package com.noi.backend.services.extraction.engine;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.noi.backend.config.ModelExtractionProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide sliding one-minute window over model calls. The only state shared between
 * documents in flight.
 */
@Slf4j
@Component
public class ExtractionRateLimiter {

    private static final long WINDOW_SECONDS = 60;

    private final ModelExtractionProperties properties;
    private final Clock clock;
    private final Deque<Instant> calls = new ArrayDeque<>();

    @Autowired
    public ExtractionRateLimiter(ModelExtractionProperties properties) {
        this(properties, Clock.systemUTC());
    }

    ExtractionRateLimiter(ModelExtractionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Records a call and returns true when the window has room; false when the limit is reached.
     */
    public synchronized boolean tryAcquire() {
        int limit = properties.getRequestsPerMinute();
        if (limit <= 0) return true;

        Instant now = clock.instant();
        Instant cutoff = now.minusSeconds(WINDOW_SECONDS);
        while (!calls.isEmpty() && calls.peekFirst().isBefore(cutoff)) {
            calls.pollFirst();
        }
        if (calls.size() >= limit) {
            log.warn("[RateLimiter] Model call limit reached ({} per minute)", limit);
            return false;
        }
        calls.addLast(now);
        return true;
    }

    public synchronized int inWindow() {
        return calls.size();
    }
}
