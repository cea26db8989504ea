package com.github.salilvnair.entityflow.intent;

public enum IntentInterpreterMode {
    HEURISTIC,
    AI_THEN_HEURISTIC;

    public static IntentInterpreterMode from(String raw, IntentInterpreterMode fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toUpperCase();
        for (IntentInterpreterMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        return fallback;
    }
}
