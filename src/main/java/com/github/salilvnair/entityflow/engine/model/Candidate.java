package com.github.salilvnair.entityflow.engine.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A ranked entity-store hit. {@code similarityScore} is always within 0..100.
 */
public record Candidate(Object id, Map<String, Object> fields, int similarityScore, String matchedField) {

    public Candidate {
        fields = fields == null ? Map.of() : Map.copyOf(withoutNulls(fields));
        similarityScore = Math.max(0, Math.min(100, similarityScore));
    }

    public Candidate withScore(int score) {
        return new Candidate(id, fields, score, matchedField);
    }

    public String matchedValue() {
        Object value = matchedField == null ? null : fields.get(matchedField);
        return value == null ? null : String.valueOf(value);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
