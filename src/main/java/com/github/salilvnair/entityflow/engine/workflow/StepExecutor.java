package com.github.salilvnair.entityflow.engine.workflow;

import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.model.ActionResult;

@FunctionalInterface
public interface StepExecutor {

    ActionResult execute(WorkflowContext ctx);
}
