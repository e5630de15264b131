package com.noi.backend.controllers;

import static com.noi.backend.services.extraction.ExtractionFixtures.SCENARIO_A_CSV;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
        "openai.api-key="
})
@AutoConfigureMockMvc
class ExtractionControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void upload_partialStatementIsExtractedWithoutModel() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "march_2024-03.csv", "text/csv",
                SCENARIO_A_CSV.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/extractions").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("EXTRACTED"))
                .andExpect(jsonPath("$.data.method").value("PATTERN_FALLBACK"))
                .andExpect(jsonPath("$.data.period").value("2024-03"))
                .andExpect(jsonPath("$.data.record.noi").value(14000.0))
                .andExpect(jsonPath("$.data.provenance.noi").value("CALCULATED"))
                .andExpect(jsonPath("$.data.overallConfidence").value("MEDIUM"));
    }

    @Test
    void upload_emptyTemplateReportsNoFinancialContent() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "template.csv", "text/csv",
                "Category,Amount\nGross Potential Rent,\nOperating Expenses,\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/extractions").file(file).param("role", "budget"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("NO_FINANCIAL_CONTENT"))
                .andExpect(jsonPath("$.data.role").value("BUDGET"))
                .andExpect(jsonPath("$.data.modelCallCount").value(0));
    }
}
