package com.noi.backend.services.extraction.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.noi.backend.config.ModelExtractionProperties;
import com.noi.backend.enums.DocumentRole;
import com.noi.backend.services.extraction.ExtractionException;
import com.noi.backend.services.extraction.ExtractionTimeoutException;
import com.noi.backend.services.extraction.ModelCallException;
import com.noi.backend.services.extraction.SchemaMismatchException;
import com.noi.backend.services.extraction.model.AttemptStrategy;
import com.noi.backend.services.extraction.model.AuditTrail;
import com.noi.backend.services.extraction.model.ExtractionAttempt;
import com.noi.backend.services.extraction.model.ExtractionAttempt.Outcome;
import com.noi.backend.services.extraction.model.ParsedRecord;
import com.noi.backend.services.extraction.model.PreprocessedContent;
import com.noi.backend.services.extraction.parsing.ResponseParser;
import com.noi.backend.services.extraction.prompt.PromptBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * Drives attempts 1..N against the model. An attempt is accepted when its output carries the
 * primary keys and at least one nonzero primary metric.
 *
 * Transient failures (timeout, rate limit) back off exponentially before the next attempt.
 * Non-transient transport failures end the loop. Nothing here throws to the caller.
 */
@Slf4j
@Service
public class ExtractionEngine {

    private final ModelClient modelClient;
    private final PromptBuilder promptBuilder;
    private final ResponseParser responseParser;
    private final ModelExtractionProperties properties;
    private final ExtractionRateLimiter rateLimiter;
    private final Executor modelCallExecutor;
    private final Sleeper sleeper;

    public ExtractionEngine(
            ModelClient modelClient,
            PromptBuilder promptBuilder,
            ResponseParser responseParser,
            ModelExtractionProperties properties,
            ExtractionRateLimiter rateLimiter,
            @Qualifier("modelCallTaskExecutor") Executor modelCallExecutor,
            Sleeper sleeper) {
        this.modelClient = modelClient;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.modelCallExecutor = modelCallExecutor;
        this.sleeper = sleeper;
    }

    public EngineOutcome extract(PreprocessedContent content, DocumentRole role, AuditTrail audit, CancellationSignal cancellation) {
        if (!modelClient.isAvailable()) {
            log.info("[ExtractionEngine] Model not configured; skipping model attempts");
            audit.record("model_unavailable", "No model configured; using pattern extraction");
            return EngineOutcome.unavailable();
        }

        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        List<ExtractionAttempt> attempts = new ArrayList<>();
        int calls = 0;
        String transportFailure = null;

        for (int n = 1; n <= maxAttempts; n++) {
            if (cancellation.isCancelled()) {
                log.info("[ExtractionEngine] Cancelled before attempt {}", n);
                audit.record("cancelled", "Cancelled before attempt %d", n);
                return new EngineOutcome(null, attempts, calls, false, true, null);
            }

            AttemptStrategy strategy = AttemptStrategy.forAttempt(n);
            String prompt = promptBuilder.build(content, role, strategy);
            String promptId = Integer.toHexString(prompt.hashCode());
            long start = System.currentTimeMillis();

            String raw = null;
            Outcome outcome;
            String detail;
            ParsedRecord parsed = null;
            try {
                if (!rateLimiter.tryAcquire()) {
                    throw new ExtractionTimeoutException("Rate limit reached for model calls");
                }
                calls++;
                raw = callWithTimeout(prompt, strategy.getTemperature());
                parsed = responseParser.parse(raw);
                responseParser.requireSchema(parsed);
                if (parsed.getRecord().hasNonZeroPrimaryMetric()) {
                    outcome = Outcome.ACCEPTED;
                    detail = parsed.getRecord().populatedCount() + " fields";
                } else {
                    outcome = Outcome.ALL_ZERO;
                    detail = "All primary metrics zero or null";
                }
                transportFailure = null;
            } catch (SchemaMismatchException e) {
                outcome = Outcome.SCHEMA_MISMATCH;
                detail = e.getMessage();
                transportFailure = null;
            } catch (ExtractionTimeoutException e) {
                outcome = Outcome.TIMEOUT;
                detail = e.getMessage();
                transportFailure = e.getMessage();
            } catch (ExtractionException e) {
                outcome = Outcome.TRANSPORT_ERROR;
                detail = e.getMessage();
                transportFailure = e.getMessage();
            }

            if (Thread.currentThread().isInterrupted()) {
                cancellation.cancel();
            }

            long elapsed = System.currentTimeMillis() - start;
            ExtractionAttempt attempt = new ExtractionAttempt(n, strategy, promptId, raw, outcome, detail, elapsed);
            attempts.add(attempt);
            audit.record("model_attempt", "attempt=%d strategy=%s prompt=%s outcome=%s detail=%s response=%s",
                    n, strategy, promptId, outcome, detail, abbreviate(raw));

            if (outcome == Outcome.ACCEPTED) {
                log.info("[ExtractionEngine] Attempt {} accepted ({}, elapsedMs={})", n, detail, elapsed);
                return new EngineOutcome(parsed, attempts, calls, false, false, null);
            }
            log.warn("[ExtractionEngine] Attempt {} rejected: {} - {} (elapsedMs={})", n, outcome, detail, elapsed);

            if (outcome == Outcome.TRANSPORT_ERROR) {
                break;
            }
            if (outcome.isTransient() && n < maxAttempts && !cancellation.isCancelled()) {
                long delay = properties.backoffFor(n);
                audit.record("backoff", "%d ms before attempt %d", delay, n + 1);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    cancellation.cancel();
                }
            }
        }

        if (cancellation.isCancelled()) {
            audit.record("cancelled", "Cancelled after %d attempts", attempts.size());
            return new EngineOutcome(null, attempts, calls, false, true, null);
        }

        if (transportFailure != null) {
            String report = String.format("Model unreachable after %d attempts: %s", attempts.size(), transportFailure);
            log.error("[ExtractionEngine] {}", report);
            audit.record("model_failure", report);
            return new EngineOutcome(null, attempts, calls, false, false, report);
        }

        audit.record("model_exhausted", "%d attempts without an acceptable result", attempts.size());
        return new EngineOutcome(null, attempts, calls, false, false, null);
    }

    private String callWithTimeout(String prompt, double temperature) {
        CompletableFuture<String> future = CompletableFuture.supplyAsync(
                () -> modelClient.complete(prompt, temperature), modelCallExecutor);
        try {
            return future.get(Math.max(1, properties.getCallTimeoutSeconds()), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExtractionTimeoutException("Model call timed out after " + properties.getCallTimeoutSeconds() + "s");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModelCallException("Interrupted while waiting for the model", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionException) {
                throw (ExtractionException) cause;
            }
            throw new ModelCallException("Model call failed: " + cause, cause);
        }
    }

    private static String abbreviate(String raw) {
        if (raw == null) return "<none>";
        String oneLine = raw.replaceAll("\\s+", " ").trim();
        return oneLine.length() > 300 ? oneLine.substring(0, 300) + "..." : oneLine;
    }
}
