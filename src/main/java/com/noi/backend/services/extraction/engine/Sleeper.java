package com.noi.backend.services.extraction.engine;

/**
 * Backoff pause between attempts. Tests replace it to run without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
