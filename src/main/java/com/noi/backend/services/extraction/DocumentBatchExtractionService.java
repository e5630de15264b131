package com.noi.backend.services.extraction;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.noi.backend.enums.DocumentRole;
import com.noi.backend.services.extraction.model.ExtractionResult;
import com.noi.backend.services.extraction.model.RawDocument;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the documents of one comparison set (current, prior, budget, prior year) side by side.
 * Each document is an independent pipeline run.
 */
@Slf4j
@Service
public class DocumentBatchExtractionService {

    private final FinancialExtractionPipeline pipeline;
    private final Executor executor;

    public DocumentBatchExtractionService(
            FinancialExtractionPipeline pipeline,
            @Qualifier("documentExtractionTaskExecutor") Executor executor) {
        this.pipeline = pipeline;
        this.executor = executor;
    }

    public Map<DocumentRole, ExtractionResult> extractAll(Map<DocumentRole, RawDocument> documents) {
        if (documents == null || !documents.containsKey(DocumentRole.CURRENT)) {
            throw new IllegalArgumentException("A current-period document is required");
        }

        Map<DocumentRole, CompletableFuture<ExtractionResult>> futures = new EnumMap<>(DocumentRole.class);
        for (Map.Entry<DocumentRole, RawDocument> e : documents.entrySet()) {
            RawDocument doc = e.getValue();
            if (doc == null) continue;
            RawDocument withRole = new RawDocument(doc.bytes(), doc.filename(), e.getKey(), doc.formatHint());
            futures.put(e.getKey(), CompletableFuture.supplyAsync(() -> pipeline.extract(withRole), executor));
        }
        log.info("[Batch] Started {} documents: {}", futures.size(), futures.keySet());

        CompletableFuture.allOf(new ArrayList<>(futures.values()).toArray(new CompletableFuture[0])).join();

        Map<DocumentRole, ExtractionResult> out = new LinkedHashMap<>();
        List<String> summary = new ArrayList<>();
        for (Map.Entry<DocumentRole, CompletableFuture<ExtractionResult>> e : futures.entrySet()) {
            ExtractionResult r = e.getValue().join();
            out.put(e.getKey(), r);
            summary.add(e.getKey().getKey() + "=" + r.getStatus());
        }
        log.info("[Batch] Finished: {}", summary);
        return out;
    }
}
