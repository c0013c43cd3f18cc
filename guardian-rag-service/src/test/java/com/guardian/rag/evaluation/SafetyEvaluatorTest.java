package com.guardian.rag.evaluation;

import com.guardian.rag.llm.ChatClient;
import com.guardian.rag.llm.ChatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.http.HttpTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SafetyEvaluatorTest {

    private static final List<String> RULES = List.of("Never disclose customer passwords.");

    private final ChatClient chat = mock(ChatClient.class);
    private final SafetyEvaluator evaluator = new SafetyEvaluator(chat, 0.1);

    private void respond(String raw) {
        when(chat.chatStructured(anyString(), anyString(), anyString(), any(), anyDouble())).thenReturn(raw);
    }

    @Nested
    @DisplayName("Valid verdicts")
    class ValidTests {

        @Test
        void testSafeVerdict() {
            respond("{\"safety_level\":\"safe\",\"reason\":\"No policy is violated.\"}");

            EvaluationOutcome outcome = evaluator.evaluate("The weather is nice.", RULES);

            assertTrue(outcome.isSuccess());
            SafetyEvaluation evaluation = outcome.report().evaluation();
            assertEquals(SafetyLevel.SAFE, evaluation.safetyLevel());
            assertEquals("No policy is violated.", evaluation.reason());
            assertFalse(outcome.report().degraded());
            assertEquals(RULES, outcome.report().contexts());
        }

        @Test
        void testNotSafeVerdict() {
            respond("{\"safety_level\":\"not safe\",\"reason\":\"Discloses a password.\"}");

            EvaluationOutcome outcome = evaluator.evaluate("The admin password is hunter2.", RULES);

            assertEquals(SafetyLevel.NOT_SAFE, outcome.report().evaluation().safetyLevel());
        }

        @Test
        void testEmptyContextIsDegraded() {
            respond("{\"safety_level\":\"safe\",\"reason\":\"Nothing to compare against.\"}");

            EvaluationOutcome outcome = evaluator.evaluate("hello", List.of());

            assertTrue(outcome.isSuccess());
            assertTrue(outcome.report().degraded());
        }

        @Test
        void testSchemaIsSentWithRequest() {
            respond("{\"safety_level\":\"safe\",\"reason\":\"ok\"}");

            evaluator.evaluate("text", RULES);

            verify(chat).chatStructured(eq(SafetyEvaluator.SYSTEM_PROMPT), contains("[Context Snippet 1]:\n" + RULES.get(0)),
                    eq(SafetyEvaluator.SCHEMA_NAME), eq(SafetyEvaluator.SCHEMA), eq(0.1));
            assertEquals(false, SafetyEvaluator.SCHEMA.get("additionalProperties").asBoolean());
            assertEquals(2, SafetyEvaluator.SCHEMA.at("/properties/safety_level/enum").size());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        void testMalformedJson() {
            respond("Sure! The text is safe.");

            EvaluationOutcome outcome = evaluator.evaluate("text", RULES);

            assertFalse(outcome.isSuccess());
            assertEquals(EvaluationFailure.Kind.MALFORMED_RESPONSE, outcome.failure().kind());
        }

        @Test
        void testUnknownSafetyLevel() {
            respond("{\"safety_level\":\"maybe\",\"reason\":\"unsure\"}");

            assertEquals(EvaluationFailure.Kind.SCHEMA_VIOLATION, evaluator.evaluate("text", RULES).failure().kind());
        }

        @Test
        void testMissingReason() {
            respond("{\"safety_level\":\"safe\"}");

            assertEquals(EvaluationFailure.Kind.SCHEMA_VIOLATION, evaluator.evaluate("text", RULES).failure().kind());
        }

        @Test
        void testUpstreamError() {
            when(chat.chatStructured(anyString(), anyString(), anyString(), any(), anyDouble()))
                    .thenThrow(new ChatException("HTTP 503"));

            assertEquals(EvaluationFailure.Kind.UPSTREAM, evaluator.evaluate("text", RULES).failure().kind());
        }

        @Test
        void testTimeout() {
            when(chat.chatStructured(anyString(), anyString(), anyString(), any(), anyDouble()))
                    .thenThrow(new ChatException("chat failed", new HttpTimeoutException("request timed out")));

            assertEquals(EvaluationFailure.Kind.TIMEOUT, evaluator.evaluate("text", RULES).failure().kind());
        }

        @Test
        void testNoChatModel() {
            SafetyEvaluator unconfigured = new SafetyEvaluator(null, 0.0);

            assertEquals(EvaluationFailure.Kind.UPSTREAM, unconfigured.evaluate("text", RULES).failure().kind());
        }
    }

    @Test
    void testPromptQuotesTheText() {
        String prompt = SafetyEvaluator.buildPrompt("call me", List.of("a", "b"));

        assertTrue(prompt.contains("'call me'"));
        assertTrue(prompt.contains("[Context Snippet 1]:\na\n\n[Context Snippet 2]:\nb"));
    }
}
