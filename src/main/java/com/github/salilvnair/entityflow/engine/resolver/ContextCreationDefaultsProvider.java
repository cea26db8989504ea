package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.constants.ContextKeys;
import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Reads {@code workspace_id} and {@code user_id} from the session state, then falls back to
 * {@code entityflow.creation.*}.
 */
@RequiredArgsConstructor
public class ContextCreationDefaultsProvider implements CreationDefaultsProvider {

    private final EntityFlowProperties properties;

    @Override
    public Optional<Object> workspaceId(WorkflowContext ctx) {
        return Optional.ofNullable(ctx.get(ContextKeys.WORKSPACE_ID, properties.getCreation().getWorkspaceId()));
    }

    @Override
    public Optional<Object> creatorId(WorkflowContext ctx) {
        return Optional.ofNullable(ctx.get(ContextKeys.USER_ID, properties.getCreation().getCreatorId()));
    }
}
