package com.guardian.rag.controller;

import com.guardian.rag.service.GuardianService;
import com.guardian.rag.service.GuardianVerdict;
import com.guardian.rag.service.PrimaryAssistantService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends a prompt to the primary assistant and runs its answer through the guardrail.
 */
@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Slf4j
public class PromptTestingController {

    private final PrimaryAssistantService primaryAssistant;
    private final GuardianService guardianService;

    public record PromptRequest(String prompt) {}

    @PostMapping("/prompt-testing")
    public ResponseEntity<Map<String, Object>> testPrompt(@RequestBody(required = false) PromptRequest request) {
        if (request == null || request.prompt() == null || request.prompt().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "prompt is required"));
        }

        String llmResponse = primaryAssistant.respond(request.prompt());
        GuardianVerdict verdict = guardianService.evaluate(llmResponse);
        log.info("Prompt test verdict: {} (degraded={}, failedClosed={})",
                verdict.evaluation().safetyLevel().value(), verdict.degraded(), verdict.failedClosed());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("llm_response", llmResponse);
        response.put("guardian_evaluation", verdict.evaluation());
        response.put("degraded", verdict.degraded());
        return ResponseEntity.ok(response);
    }
}
