package com.github.salilvnair.entityflow.store;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Case-insensitive lookup of {@code value} across {@code fields}, restricted to {@code scope}.
 */
public record EntityQuery(Map<String, Object> scope, List<String> fields, String value, MatchMode mode) {

    public enum MatchMode {
        EXACT,
        CONTAINS
    }

    public EntityQuery {
        scope = scope == null ? Map.of() : Map.copyOf(scope);
        fields = fields == null ? List.of() : List.copyOf(fields);
        mode = mode == null ? MatchMode.EXACT : mode;
    }

    public static EntityQuery exact(Map<String, Object> scope, List<String> fields, String value) {
        return new EntityQuery(scope, fields, value, MatchMode.EXACT);
    }

    public static EntityQuery contains(Map<String, Object> scope, List<String> fields, String value) {
        return new EntityQuery(scope, fields, value, MatchMode.CONTAINS);
    }

    /** Reference semantics for stores that filter in memory. */
    public boolean matches(EntityRecord entity) {
        for (Map.Entry<String, Object> entry : scope.entrySet()) {
            Object actual = entity.value(entry.getKey());
            if (actual == null || !Objects.equals(String.valueOf(actual), String.valueOf(entry.getValue()))) {
                return false;
            }
        }
        if (value == null || value.isBlank()) {
            return false;
        }
        String needle = value.trim().toLowerCase(Locale.ROOT);
        for (String field : fields) {
            String candidate = entity.text(field);
            if (candidate == null) {
                continue;
            }
            String hay = candidate.trim().toLowerCase(Locale.ROOT);
            if (mode == MatchMode.EXACT ? hay.equals(needle) : hay.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
