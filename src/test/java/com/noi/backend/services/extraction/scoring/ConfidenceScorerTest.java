package com.noi.backend.services.extraction.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.noi.backend.config.ConsistencyConfig;
import com.noi.backend.enums.ConfidenceLevel;
import com.noi.backend.enums.DocumentFormat;
import com.noi.backend.enums.FieldProvenance;
import com.noi.backend.services.extraction.ExtractionFixtures;
import com.noi.backend.services.extraction.model.FinancialField;
import com.noi.backend.services.extraction.model.ParsedRecord;
import com.noi.backend.services.extraction.model.PreprocessedContent;
import com.noi.backend.services.extraction.model.RawDocument;
import com.noi.backend.services.extraction.parsing.PatternExtractor;
import com.noi.backend.services.extraction.validation.ConsistencyValidator;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer(new ConsistencyConfig());

    private static final PreprocessedContent STATEMENT = PreprocessedContent.builder()
            .format(DocumentFormat.TXT)
            .filename("stmt.txt")
            .header("TXT DOCUMENT: stmt.txt")
            .body("Gross Potential Rent 120,000.00\n"
                    + "Effective Gross Income 114,000.00\n"
                    + "Total Operating Expenses 40,000.00\n"
                    + "Misc 74,000.00\n")
            .build();

    @Test
    void score_ranksModelValuesByWhereTheyAppear() {
        ParsedRecord parsed = ParsedRecord.empty();
        parsed.put(FinancialField.GPR, new BigDecimal("120000"), FieldProvenance.MODEL_EXTRACTED);
        parsed.put(FinancialField.EGI, new BigDecimal("114000"), FieldProvenance.MODEL_EXTRACTED);
        parsed.put(FinancialField.OPEX, new BigDecimal("74000"), FieldProvenance.MODEL_EXTRACTED);
        parsed.put(FinancialField.NOI, new BigDecimal("99999"), FieldProvenance.MODEL_EXTRACTED);

        ConfidenceReport report = scorer.score(parsed, STATEMENT);

        assertEquals(0.95, report.scoreOf(FinancialField.GPR), 1e-9);
        assertEquals(0.85, report.scoreOf(FinancialField.OPEX), 1e-9);
        assertEquals(0.40, report.scoreOf(FinancialField.NOI), 1e-9);
        assertEquals(FieldProvenance.MODEL_INFERRED, report.provenance().get(FinancialField.NOI));
        assertEquals(0.40, report.overallScore(), 1e-9);
        assertEquals(ConfidenceLevel.LOW, report.level());
    }

    private static ParsedRecord modelAnswer(String gpr, String egi, String opex, String noi) {
        ParsedRecord parsed = ParsedRecord.empty();
        parsed.put(FinancialField.GPR, new BigDecimal(gpr), FieldProvenance.MODEL_EXTRACTED);
        parsed.put(FinancialField.EGI, new BigDecimal(egi), FieldProvenance.MODEL_EXTRACTED);
        parsed.put(FinancialField.OPEX, new BigDecimal(opex), FieldProvenance.MODEL_EXTRACTED);
        parsed.put(FinancialField.NOI, new BigDecimal(noi), FieldProvenance.MODEL_EXTRACTED);
        return parsed;
    }

    @Test
    void score_modelNoiDerivedFromIdentityCountsAsCalculated() {
        PreprocessedContent content = ExtractionFixtures.preprocessor().preprocess(
                new RawDocument(ExtractionFixtures.utf8(ExtractionFixtures.SCENARIO_A_CSV), "a.csv", null));

        ConfidenceReport report = scorer.score(modelAnswer("30000", "30000", "16000", "14000"), content);

        assertEquals(0.95, report.scoreOf(FinancialField.GPR), 1e-9);
        assertEquals(0.85, report.scoreOf(FinancialField.EGI), 1e-9);
        assertEquals(FieldProvenance.CALCULATED, report.provenance().get(FinancialField.NOI));
        assertEquals(0.77, report.scoreOf(FinancialField.NOI), 1e-9);
        assertEquals(0.77, report.overallScore(), 1e-9);
        assertEquals(ConfidenceLevel.MEDIUM, report.level());
    }

    @Test
    void score_identityMatchHonorsTolerance() {
        PreprocessedContent content = ExtractionFixtures.preprocessor().preprocess(
                new RawDocument(ExtractionFixtures.utf8(ExtractionFixtures.SCENARIO_A_CSV), "a.csv", null));

        ConfidenceReport withinTolerance = scorer.score(modelAnswer("30000", "30000", "16000", "14000.80"), content);
        ConfidenceReport outsideTolerance = scorer.score(modelAnswer("30000", "30000", "16000", "14002"), content);

        assertEquals(FieldProvenance.CALCULATED, withinTolerance.provenance().get(FinancialField.NOI));
        assertEquals(FieldProvenance.MODEL_INFERRED, outsideTolerance.provenance().get(FinancialField.NOI));
        assertEquals(0.40, outsideTolerance.scoreOf(FinancialField.NOI), 1e-9);
        assertEquals(ConfidenceLevel.LOW, outsideTolerance.level());
    }

    @Test
    void score_calculatedValueFollowsWeakestInput() {
        ParsedRecord parsed = ParsedRecord.empty();
        parsed.put(FinancialField.EGI, new BigDecimal("114000"), FieldProvenance.MODEL_EXTRACTED);
        parsed.put(FinancialField.OPEX, new BigDecimal("40000"), FieldProvenance.MODEL_EXTRACTED);
        parsed.put(FinancialField.NOI, new BigDecimal("74000"), FieldProvenance.CALCULATED);

        ConfidenceReport report = scorer.score(parsed, STATEMENT);

        assertEquals(0.79, report.scoreOf(FinancialField.NOI), 1e-9);
        assertEquals(FieldProvenance.CALCULATED, report.provenance().get(FinancialField.NOI));
        assertEquals(0.0, report.scoreOf(FinancialField.GPR), 1e-9);
        assertEquals(FieldProvenance.UNRESOLVED, report.provenanceByKey().get("gpr"));
        assertEquals(ConfidenceLevel.UNCERTAIN, report.level());
    }

    @Test
    void score_patternRecordWithDerivedTotalsIsMedium() {
        PreprocessedContent content = ExtractionFixtures.preprocessor().preprocess(
                new RawDocument(ExtractionFixtures.utf8(ExtractionFixtures.SCENARIO_A_CSV), "a.csv", null));
        ParsedRecord parsed = new PatternExtractor().extract(content);
        new ConsistencyValidator(new ConsistencyConfig()).validate(parsed);

        ConfidenceReport report = scorer.score(parsed, content);

        assertEquals(0.65, report.scoreOf(FinancialField.GPR), 1e-9);
        assertEquals(0.73, report.scoreOf(FinancialField.EGI), 1e-9);
        assertEquals(0.73, report.scoreOf(FinancialField.NOI), 1e-9);
        assertEquals(0.65, report.overallScore(), 1e-9);
        assertEquals(ConfidenceLevel.MEDIUM, report.level());
    }
}
