package com.github.salilvnair.entityflow.intent;

public enum UserIntent {
    CONFIRM,
    DECLINE,
    MODIFY,
    USE,
    CREATE,
    UNCLEAR;

    public static UserIntent from(String raw, UserIntent fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toUpperCase();
        for (UserIntent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return fallback;
    }
}
