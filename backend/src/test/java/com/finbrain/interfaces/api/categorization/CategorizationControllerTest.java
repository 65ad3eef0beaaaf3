package com.finbrain.interfaces.api.categorization;

import com.finbrain.application.categorization.CategorizationOrchestrator;
import com.finbrain.domain.inference.model.CategorizationResult;
import com.finbrain.domain.inference.model.CategorizationSource;
import com.finbrain.domain.inference.model.ConfidenceDecision;
import com.finbrain.domain.inference.model.ConfidenceResult;
import com.finbrain.domain.inference.model.ConfidenceTier;
import com.finbrain.domain.inference.model.DegradationReason;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CategorizationController.class)
class CategorizationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CategorizationOrchestrator orchestrator;

    @Test
    void returnsCategorization() throws Exception {
        ConfidenceResult confidence = new ConfidenceResult(0.53, ConfidenceTier.LOW,
                Map.of("model_probability", 0.13), ConfidenceDecision.REJECT);
        when(orchestrator.categorize(eq("ZELLE TO J DOE"), any())).thenReturn(new CategorizationResult(
                "Other", CategorizationSource.FAST_PATH_FALLBACK, confidence, true, true, true,
                DegradationReason.CIRCUIT_OPEN, List.of()));

        mockMvc.perform(post("/api/v1/categorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"ZELLE TO J DOE\",\"sourceFacts\":{\"monthly_income\":4000}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.category").value("Other"))
                .andExpect(jsonPath("$.source").value("FAST_PATH_FALLBACK"))
                .andExpect(jsonPath("$.tier").value("LOW"))
                .andExpect(jsonPath("$.lowConfidence").value(true))
                .andExpect(jsonPath("$.degradationReason").value("CIRCUIT_OPEN"))
                .andExpect(jsonPath("$.issues").doesNotExist());
    }

    @Test
    void blankDescriptionIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/categorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Description is required"));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/categorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }
}
