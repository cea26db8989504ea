package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.model.ActionResult;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;

import java.util.List;

/**
 * Takes over resolution for fields whose {@link ResolutionConfig#getResolver()} names it.
 * Register implementations as beans.
 */
public interface CustomEntityResolver {

    /** Value of {@code resolver} in the field config that routes to this resolver. */
    String id();

    ActionResult resolve(String field, ResolutionConfig config, Object identifier, WorkflowContext ctx);

    default ActionResult resolveBatch(String field, ResolutionConfig config, List<?> items, WorkflowContext ctx) {
        return ActionResult.failure("Custom resolver " + id() + " does not resolve lists");
    }
}
