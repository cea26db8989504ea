package com.github.salilvnair.entityflow.store.memory;

import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.store.SessionStore;
import com.github.salilvnair.entityflow.util.JsonUtil;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps each context as a JSON snapshot, so callers never share mutable state with the store.
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<WorkflowContext> load(String sessionId) {
        String json = snapshots.get(sessionId);
        return json == null ? Optional.empty() : Optional.of(JsonUtil.fromJson(json, WorkflowContext.class));
    }

    @Override
    public void save(String sessionId, WorkflowContext context) {
        snapshots.put(sessionId, JsonUtil.toJson(context));
    }

    @Override
    public void delete(String sessionId) {
        snapshots.remove(sessionId);
    }
}
