package com.github.salilvnair.entityflow.store;

import com.github.salilvnair.entityflow.engine.context.WorkflowContext;

import java.util.Optional;

/**
 * Durable home of a session's {@link WorkflowContext} between turns. Loads must return an
 * independent copy; writes replace the stored context as a whole.
 */
public interface SessionStore {

    Optional<WorkflowContext> load(String sessionId);

    void save(String sessionId, WorkflowContext context);

    default void delete(String sessionId) {
    }
}
