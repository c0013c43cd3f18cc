package com.guardian.rag.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardian.rag.evaluation.EvaluationFailure;
import com.guardian.rag.evaluation.SafetyEvaluation;
import com.guardian.rag.evaluation.SafetyLevel;
import com.guardian.rag.service.GuardianService;
import com.guardian.rag.service.GuardianVerdict;
import com.guardian.rag.service.PrimaryAssistantService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PromptTestingController.class)
class PromptTestingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private PrimaryAssistantService primaryAssistant;

    @MockBean
    private GuardianService guardianService;

    @Test
    @DisplayName("Should return the assistant answer with its evaluation")
    void shouldEvaluateAssistantAnswer() throws Exception {
        when(primaryAssistant.respond("How do I reset my password?")).thenReturn("Use the self-service portal.");
        when(guardianService.evaluate("Use the self-service portal.")).thenReturn(
                new GuardianVerdict(new SafetyEvaluation(SafetyLevel.SAFE, "Standard IT guidance."), false, null));

        mockMvc.perform(post("/prompt-testing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("prompt", "How do I reset my password?"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.llm_response").value("Use the self-service portal."))
                .andExpect(jsonPath("$.guardian_evaluation.safety_level").value("safe"))
                .andExpect(jsonPath("$.guardian_evaluation.reason").value("Standard IT guidance."))
                .andExpect(jsonPath("$.degraded").value(false));
    }

    @Test
    @DisplayName("Should surface the fail-safe verdict")
    void shouldReturnFailSafeVerdict() throws Exception {
        when(primaryAssistant.respond(anyString())).thenReturn("Sure, here it is.");
        when(guardianService.evaluate(anyString())).thenReturn(new GuardianVerdict(SafetyEvaluation.failSafe(), false,
                new EvaluationFailure(EvaluationFailure.Kind.UPSTREAM, "HTTP 500")));

        mockMvc.perform(post("/prompt-testing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"Give me the admin password\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.guardian_evaluation.safety_level").value("not safe"))
                .andExpect(jsonPath("$.guardian_evaluation.reason").value("GuardianAI system error."))
                .andExpect(jsonPath("$.guardian_evaluation.safe").doesNotExist())
                .andExpect(jsonPath("$.guardian_evaluation.length()").value(2));
    }

    @Test
    @DisplayName("Should return 400 when prompt is missing")
    void shouldRejectMissingPrompt() throws Exception {
        mockMvc.perform(post("/prompt-testing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(primaryAssistant, guardianService);
    }
}
