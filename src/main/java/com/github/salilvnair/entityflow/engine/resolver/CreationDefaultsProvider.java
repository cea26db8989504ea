package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.engine.context.WorkflowContext;

import java.util.Optional;

/**
 * Supplies ownership values stamped on automatically created entities.
 */
public interface CreationDefaultsProvider {

    Optional<Object> workspaceId(WorkflowContext ctx);

    Optional<Object> creatorId(WorkflowContext ctx);
}
