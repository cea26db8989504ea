package com.github.salilvnair.entityflow.engine.resolver;

import java.util.List;
import java.util.Map;

/**
 * Items split into those matching a stored entity and those that do not. Every input item
 * lands in exactly one of the two lists.
 */
public record BatchPartition(List<Map<String, Object>> validated, List<Map<String, Object>> missing) {

    public BatchPartition {
        validated = List.copyOf(validated);
        missing = List.copyOf(missing);
    }

    public int size() {
        return validated.size() + missing.size();
    }
}
