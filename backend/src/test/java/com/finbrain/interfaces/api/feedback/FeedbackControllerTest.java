package com.finbrain.interfaces.api.feedback;

import com.finbrain.domain.inference.service.FeedbackHook;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FeedbackController.class)
class FeedbackControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FeedbackHook feedbackHook;

    @Test
    void correctionIsAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/feedback/corrections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalCategory\":\"Shopping & Retail\",\"correctedCategory\":\"Subscriptions\","
                                + "\"description\":\"AMAZON PRIME VIDEO\"}"))
                .andExpect(status().isAccepted());

        verify(feedbackHook).recordCorrection("Shopping & Retail", "Subscriptions", "AMAZON PRIME VIDEO");
    }

    @Test
    void missingCorrectedCategoryIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/feedback/corrections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"AMAZON PRIME VIDEO\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Corrected category is required"));

        verifyNoInteractions(feedbackHook);
    }
}
