package com.noi.backend.controllers;

import java.io.IOException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.noi.backend.dto.ApiResponse;
import com.noi.backend.enums.DocumentFormat;
import com.noi.backend.enums.DocumentRole;
import com.noi.backend.exceptions.BadRequestException;
import com.noi.backend.services.extraction.DocumentBatchExtractionService;
import com.noi.backend.services.extraction.FinancialExtractionPipeline;
import com.noi.backend.services.extraction.model.ExtractionResult;
import com.noi.backend.services.extraction.model.RawDocument;
import com.noi.backend.services.extraction.preprocessing.FormatResolver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/extractions")
@RequiredArgsConstructor
@Slf4j
public class ExtractionController {

    private final FinancialExtractionPipeline pipeline;
    private final DocumentBatchExtractionService batchService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ExtractionResult>> extract(
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "role", required = false) String role,
            @RequestParam(value = "formatHint", required = false) String formatHint
    ) throws IOException {
        RawDocument document = toDocument(file, parseRole(role), formatHint, "file");
        log.info("[API] Extraction requested: {}", document);

        ExtractionResult result = pipeline.extract(document);
        return ResponseEntity.ok(ApiResponse.success(result, result.getMessage()));
    }

    @PostMapping(value = "/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<Map<String, ExtractionResult>>> extractBatch(
            @RequestParam(value = "current", required = false) MultipartFile current,
            @RequestParam(value = "prior", required = false) MultipartFile prior,
            @RequestParam(value = "budget", required = false) MultipartFile budget,
            @RequestParam(value = "priorYear", required = false) MultipartFile priorYear
    ) throws IOException {
        Map<DocumentRole, RawDocument> documents = new EnumMap<>(DocumentRole.class);
        documents.put(DocumentRole.CURRENT, toDocument(current, DocumentRole.CURRENT, null, "current"));
        putIfPresent(documents, DocumentRole.PRIOR, prior);
        putIfPresent(documents, DocumentRole.BUDGET, budget);
        putIfPresent(documents, DocumentRole.PRIOR_YEAR, priorYear);

        Map<String, ExtractionResult> payload = new LinkedHashMap<>();
        batchService.extractAll(documents).forEach((r, result) -> payload.put(r.getKey(), result));
        return ResponseEntity.ok(ApiResponse.success(payload, documents.size() + " documents processed"));
    }

    private static void putIfPresent(Map<DocumentRole, RawDocument> documents, DocumentRole role, MultipartFile file)
            throws IOException {
        if (file != null && !file.isEmpty()) {
            documents.put(role, toDocument(file, role, null, role.getKey()));
        }
    }

    private static RawDocument toDocument(MultipartFile file, DocumentRole role, String formatHint, String part)
            throws IOException {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException("File '" + part + "' is missing or empty");
        }
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        return new RawDocument(file.getBytes(), filename, role, resolveHint(formatHint, filename, file.getContentType()));
    }

    /**
     * An explicit hint wins; the browser content type is used only when the filename has no known extension.
     */
    static String resolveHint(String formatHint, String filename, String contentType) {
        if (formatHint != null && !formatHint.isBlank()) return formatHint;
        if (FormatResolver.fromExtension(filename) != DocumentFormat.UNKNOWN) return null;
        return contentType;
    }

    private static DocumentRole parseRole(String role) {
        if (role == null || role.isBlank()) return null;
        DocumentRole parsed = DocumentRole.fromValue(role);
        if (parsed == null) {
            throw new BadRequestException("Unknown document role: " + role);
        }
        return parsed;
    }
}
