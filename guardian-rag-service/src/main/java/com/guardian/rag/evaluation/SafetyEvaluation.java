package com.guardian.rag.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The verdict returned to callers. Both fields are always set.
 */
public record SafetyEvaluation(
        @JsonProperty("safety_level") SafetyLevel safetyLevel,
        @JsonProperty("reason") String reason
) {
    public static final String SYSTEM_ERROR_REASON = "GuardianAI system error.";

    private static final SafetyEvaluation FAIL_SAFE = new SafetyEvaluation(SafetyLevel.NOT_SAFE, SYSTEM_ERROR_REASON);

    public SafetyEvaluation {
        Objects.requireNonNull(safetyLevel, "safetyLevel");
        Objects.requireNonNull(reason, "reason");
    }

    /**
     * The conservative verdict used whenever an evaluation could not be completed.
     */
    public static SafetyEvaluation failSafe() {
        return FAIL_SAFE;
    }
}
