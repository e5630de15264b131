package com.noi.backend.services.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.noi.backend.enums.ConfidenceLevel;
import com.noi.backend.enums.DocumentRole;
import com.noi.backend.enums.ExtractionMethod;
import com.noi.backend.enums.ExtractionStatus;
import com.noi.backend.enums.FieldProvenance;
import com.noi.backend.services.extraction.engine.CancellationSignal;
import com.noi.backend.services.extraction.engine.EngineOutcome;
import com.noi.backend.services.extraction.engine.ExtractionEngine;
import com.noi.backend.services.extraction.model.AuditTrail;
import com.noi.backend.services.extraction.model.ExtractionResult;
import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.model.ParsedRecord;
import com.noi.backend.services.extraction.model.PreprocessedContent;
import com.noi.backend.services.extraction.model.RawDocument;
import com.noi.backend.services.extraction.parsing.PatternExtractor;
import com.noi.backend.services.extraction.preprocessing.DocumentPreprocessor;
import com.noi.backend.services.extraction.scoring.ConfidenceReport;
import com.noi.backend.services.extraction.scoring.ConfidenceScorer;
import com.noi.backend.services.extraction.util.PeriodDetector;
import com.noi.backend.services.extraction.util.TextNormalizer;
import com.noi.backend.services.extraction.validation.ConsistencyReport;
import com.noi.backend.services.extraction.validation.ConsistencyValidator;
import com.noi.backend.services.extraction.validation.ContentValidation;
import com.noi.backend.services.extraction.validation.ContentValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One document in, one {@link ExtractionResult} out:
 * preprocess, gate, model attempts, pattern fallback, consistency repair, confidence.
 *
 * Format and content problems come back as statuses, never as exceptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialExtractionPipeline {

    private final DocumentPreprocessor preprocessor;
    private final ContentValidator contentValidator;
    private final ExtractionEngine extractionEngine;
    private final PatternExtractor patternExtractor;
    private final ConsistencyValidator consistencyValidator;
    private final ConfidenceScorer confidenceScorer;

    private final AtomicBoolean debugConfigLoggedOnce = new AtomicBoolean(false);

    @Value("${noi.extraction.debug.log-extracted-text:false}")
    private boolean logExtractedText;

    @Value("${noi.extraction.debug.extracted-text-max-chars:2000}")
    private int extractedTextMaxChars;

    public ExtractionResult extract(RawDocument document) {
        return extract(document, CancellationSignal.none());
    }

    public ExtractionResult extract(RawDocument document, CancellationSignal cancellation) {
        long start = System.nanoTime();
        logDebugConfigOnce();

        AuditTrail audit = new AuditTrail();
        DocumentRole role = document.declaredRole() != null
                ? document.declaredRole()
                : DocumentRole.fromFilename(document.filename());
        String period = PeriodDetector.fromFilename(document.filename());
        audit.record("received", "file=%s bytes=%d role=%s%s period=%s", document.filename(), document.size(),
                role.getKey(), document.declaredRole() == null ? " (from filename)" : "", period);

        PreprocessedContent content = preprocessor.preprocess(document);
        audit.record("preprocessed", content.getDescription());
        for (String indicator : content.getStructureIndicators()) {
            audit.record("structure", indicator);
        }
        logExtractedTextIfEnabled(content);

        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder()
                .filename(document.filename())
                .role(role)
                .format(content.getFormat())
                .period(period)
                .auditTrail(audit);

        if (!content.isReadable()) {
            audit.record("unsupported_format", content.getFailureReason());
            return finish(result.status(ExtractionStatus.UNSUPPORTED_FORMAT)
                    .message("Unsupported or unreadable document: " + content.getFailureReason())
                    .method(ExtractionMethod.NONE)
                    .overallConfidence(ConfidenceLevel.UNCERTAIN), start);
        }

        if (cancellation.isCancelled()) {
            audit.record("cancelled", "Cancelled after preprocessing");
            return finish(cancelled(result), start);
        }

        ContentValidation gate = contentValidator.validate(content);
        audit.record("content_gate", "passed=%s %s", gate.hasFinancialContent(), gate.reason());
        if (!gate.hasFinancialContent()) {
            return finish(result.status(ExtractionStatus.NO_FINANCIAL_CONTENT)
                    .message("No financial data found in document: " + gate.reason())
                    .method(ExtractionMethod.NONE)
                    .overallConfidence(ConfidenceLevel.UNCERTAIN), start);
        }

        EngineOutcome outcome = extractionEngine.extract(content, role, audit, cancellation);
        result.modelCallCount(outcome.modelCalls()).attempts(outcome.attempts());
        if (outcome.cancelled()) {
            return finish(cancelled(result), start);
        }

        ParsedRecord parsed;
        ExtractionMethod method;
        if (outcome.isAccepted()) {
            parsed = outcome.accepted();
            method = ExtractionMethod.MODEL;
            supplementFromPatterns(parsed, content, audit);
        } else {
            parsed = patternExtractor.extract(content);
            method = ExtractionMethod.PATTERN_FALLBACK;
            audit.record("pattern_fallback", "%d fields found", parsed.getRecord().populatedCount());
            if (outcome.transportFailure() != null) {
                result.warning(outcome.transportFailure());
            }
        }
        result.method(method);

        if (parsed.isEmpty()) {
            audit.record("uncertain", "No field could be identified");
            return finish(result.status(ExtractionStatus.UNCERTAIN)
                    .message("Extraction was attempted but no financial fields could be identified")
                    .overallConfidence(ConfidenceLevel.UNCERTAIN), start);
        }

        ConsistencyReport consistency = consistencyValidator.validate(parsed);
        for (String repair : consistency.getRepairs()) {
            audit.record("consistency_repair", repair);
        }
        for (String warning : consistency.getWarnings()) {
            audit.record("consistency_warning", warning);
            result.warning(warning);
        }

        ConfidenceReport confidence = confidenceScorer.score(parsed, content);
        audit.record("confidence", "overall=%s score=%.2f", confidence.level(), confidence.overallScore());

        ExtractionStatus status = confidence.level() == ConfidenceLevel.UNCERTAIN
                ? ExtractionStatus.UNCERTAIN
                : ExtractionStatus.EXTRACTED;
        String message = status == ExtractionStatus.EXTRACTED
                ? String.format("Extracted %d fields (%s confidence)", parsed.getRecord().populatedCount(), confidence.level())
                : "Extraction uncertain: at least one primary metric could not be established";

        log.info("[Pipeline] {} -> {} via {} (fields={}, confidence={})", document.filename(), status, method,
                parsed.getRecord().populatedCount(), confidence.level());

        return finish(result.status(status)
                .message(message)
                .record(parsed.getRecord())
                .fieldConfidence(confidence.scoresByKey())
                .provenance(confidence.provenanceByKey())
                .overallConfidence(confidence.level())
                .overallScore(confidence.overallScore()), start);
    }

    /**
     * An accepted model answer that leaves a primary metric empty gets its empty fields
     * from the pattern path. Model values are never replaced.
     */
    private void supplementFromPatterns(ParsedRecord parsed, PreprocessedContent content, AuditTrail audit) {
        boolean missingPrimary = false;
        for (FinancialField f : FinancialField.PRIMARY_METRICS) {
            if (!parsed.getRecord().has(f)) missingPrimary = true;
        }
        if (!missingPrimary) return;

        ParsedRecord patterns = patternExtractor.extract(content);
        List<String> filled = new ArrayList<>();
        for (FinancialField f : FinancialField.values()) {
            if (parsed.getRecord().has(f) || !patterns.getRecord().has(f)) continue;
            parsed.put(f, patterns.getRecord().get(f), FieldProvenance.PATTERN_FALLBACK);
            filled.add(f.getKey());
        }
        audit.record("pattern_supplement", "Model answer incomplete; filled from patterns: %s",
                filled.isEmpty() ? "none" : String.join(", ", filled));
        log.info("[Pipeline] Model answer missing primary metrics; {} fields filled from patterns", filled.size());
    }

    private static ExtractionResult.ExtractionResultBuilder cancelled(ExtractionResult.ExtractionResultBuilder result) {
        return result.status(ExtractionStatus.CANCELLED)
                .message("Extraction cancelled")
                .method(ExtractionMethod.NONE)
                .overallConfidence(ConfidenceLevel.UNCERTAIN);
    }

    private static ExtractionResult finish(ExtractionResult.ExtractionResultBuilder result, long startNanos) {
        return result.processingTimeMs((System.nanoTime() - startNanos) / 1_000_000).build();
    }

    private void logExtractedTextIfEnabled(PreprocessedContent content) {
        if (!logExtractedText) return;
        log.info("[Pipeline][DEBUG] Prompt-ready text for {} ({} chars):\n{}", content.getFilename(),
                content.bodyOrEmpty().length(), TextNormalizer.truncate(content.promptText(), extractedTextMaxChars));
    }

    private void logDebugConfigOnce() {
        if (!debugConfigLoggedOnce.compareAndSet(false, true)) return;
        log.info("[Pipeline] debug.logExtractedText={} debug.maxChars={}", logExtractedText, extractedTextMaxChars);
    }
}
