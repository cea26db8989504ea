package com.github.salilvnair.entityflow.engine.exception;

public enum EntityFlowErrorCode {

    // =========================
    // Configuration errors
    // =========================
    CONFIGURATION_ERROR(
            "Entity resolution is misconfigured",
            false
    ),

    // =========================
    // Resolution outcomes
    // =========================
    NOT_FOUND(
            "No matching entity found",
            true
    ),

    AMBIGUOUS_MATCH(
            "Several similar entities were found",
            true
    ),

    USER_DECLINED(
            "Entity creation cancelled by user",
            true
    ),

    // =========================
    // Provider errors
    // =========================
    PROVIDER_ERROR(
            "Text completion provider call failed",
            true
    ),

    PROVIDER_TIMEOUT(
            "Text completion provider call timed out",
            true
    ),

    PROVIDER_INVALID_RESPONSE(
            "Text completion provider returned an invalid response",
            true
    ),

    // =========================
    // Workflow errors
    // =========================
    SUBFLOW_FAILED(
            "Nested creation workflow failed",
            true
    ),

    WORKFLOW_STACK_OVERFLOW(
            "Workflow nesting is too deep",
            false
    ),

    STEP_LIMIT_EXCEEDED(
            "Workflow step execution limit exceeded",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal entity resolution error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    EntityFlowErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
