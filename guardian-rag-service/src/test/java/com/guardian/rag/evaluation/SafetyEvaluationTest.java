package com.guardian.rag.evaluation;

import com.guardian.rag.json.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SafetyEvaluationTest {

    @Test
    @DisplayName("Fail-safe verdict serializes to exactly two fields")
    void testFailSafeSerialization() throws Exception {
        assertEquals("{\"safety_level\":\"not safe\",\"reason\":\"GuardianAI system error.\"}",
                Json.MAPPER.writeValueAsString(SafetyEvaluation.failSafe()));
    }

    @Test
    void testSafeVerdictSerialization() throws Exception {
        SafetyEvaluation evaluation = new SafetyEvaluation(SafetyLevel.SAFE, "No policy applies.");

        assertEquals("{\"safety_level\":\"safe\",\"reason\":\"No policy applies.\"}",
                Json.MAPPER.writeValueAsString(evaluation));
    }

    @Test
    void testRejectsMissingFields() {
        assertThrows(NullPointerException.class, () -> new SafetyEvaluation(null, "r"));
        assertThrows(NullPointerException.class, () -> new SafetyEvaluation(SafetyLevel.SAFE, null));
    }
}
