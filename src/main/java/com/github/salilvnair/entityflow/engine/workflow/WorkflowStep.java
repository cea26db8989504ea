package com.github.salilvnair.entityflow.engine.workflow;

import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.model.ActionResult;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * One step of a workflow. {@code onSuccess}/{@code onFailure} name the next step; a missing
 * route ends the workflow on that outcome.
 */
@Getter
@Builder
public class WorkflowStep {

    @NonNull
    private final String name;

    @NonNull
    private final StepExecutor executor;

    private final String onSuccess;

    private final String onFailure;

    public ActionResult execute(WorkflowContext ctx) {
        return executor.execute(ctx);
    }
}
