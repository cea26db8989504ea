package com.github.salilvnair.entityflow.engine.workflow;

import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.constants.ContextKeys;
import com.github.salilvnair.entityflow.engine.context.StackFrame;
import com.github.salilvnair.entityflow.engine.context.SubflowSlot;
import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import com.github.salilvnair.entityflow.engine.model.ActionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executes workflow steps from the context cursor until a step needs user input or the
 * workflow ends.
 */
@Slf4j
@Component
public class WorkflowRunner {

    private final WorkflowRegistry registry;
    private final int maxStepExecutions;

    public WorkflowRunner(WorkflowRegistry registry, EntityFlowProperties properties) {
        this.registry = registry;
        this.maxStepExecutions = properties.getWorkflow().getMaxStepExecutions();
    }

    /**
     * Host entry point. When a subflow finishes, the parent step that started it is run
     * again so its resolver can pick up the result.
     */
    public ActionResult run(WorkflowContext ctx) {
        return execute(ctx, false);
    }

    /**
     * Runs only the active subflow. Returns a success carrying {@code subflow_completed}
     * as soon as the cursor is handed back to the parent.
     */
    public ActionResult runSubflow(WorkflowContext ctx) {
        return execute(ctx, true);
    }

    private ActionResult execute(WorkflowContext ctx, boolean stopAtParentBoundary) {
        for (int executed = 0; executed < maxStepExecutions; executed++) {
            if (ctx.getCurrentWorkflow() == null || ctx.getCurrentStep() == null) {
                return ActionResult.failure("No workflow step is active");
            }
            WorkflowDefinition definition = registry.require(ctx.getCurrentWorkflow());
            String prefix = stepPrefix(ctx);
            WorkflowStep step = definition.step(prefix, ctx.getCurrentStep())
                    .orElseThrow(() -> new EntityFlowException(EntityFlowErrorCode.CONFIGURATION_ERROR,
                            "Step " + ctx.getCurrentStep() + " not found in workflow " + definition.workflowId()));
            Optional<SubflowSlot.ActiveSubflow> owner = ctx.activeSubflowSlot().filter(a -> a.owns(step.getName()));

            ActionResult result = runStep(step, ctx);
            if (result.needsUserInput()) {
                return result;
            }
            if (!step.getName().equals(ctx.getCurrentStep())) {
                // the step moved the cursor itself, e.g. it started a nested workflow
                continue;
            }
            String next = result.isSuccess() ? step.getOnSuccess() : step.getOnFailure();
            if (next != null) {
                log.debug("Workflow {} moving {} -> {}", definition.workflowId(), step.getName(), next);
                ctx.setCurrentStep(next);
                continue;
            }
            if (owner.isPresent()) {
                if (result instanceof ActionResult.Failure failure) {
                    return subflowFailure(owner.get(), step, failure);
                }
                returnToParentCursor(ctx);
                log.info("Subflow {} finished, cursor back at {}", owner.get().workflowId(), ctx.getCurrentStep());
                if (stopAtParentBoundary) {
                    Map<String, Object> data = new LinkedHashMap<>(((ActionResult.Success) result).data());
                    data.put(ContextKeys.DATA_SUBFLOW_COMPLETED, true);
                    return ActionResult.success(result.text(), data);
                }
                continue;
            }
            if (result.isSuccess()) {
                ctx.setCurrentStep(null);
            }
            return result;
        }
        log.error("Workflow {} exceeded {} step executions", ctx.getCurrentWorkflow(), maxStepExecutions);
        return ActionResult.failure(EntityFlowErrorCode.STEP_LIMIT_EXCEEDED.defaultMessage()
                + " (" + maxStepExecutions + ") in workflow " + ctx.getCurrentWorkflow());
    }

    private ActionResult runStep(WorkflowStep step, WorkflowContext ctx) {
        try {
            ActionResult result = step.execute(ctx);
            return result == null ? ActionResult.failure("Step " + step.getName() + " returned no result") : result;
        } catch (EntityFlowException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("Step {} failed: {}", step.getName(), e.getMessage());
            return ActionResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Step {} failed", step.getName(), e);
            return ActionResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private ActionResult subflowFailure(SubflowSlot.ActiveSubflow owner, WorkflowStep step, ActionResult.Failure failure) {
        log.warn("Subflow {} failed at {}: {}", owner.workflowId(), step.getName(), failure.error());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ContextKeys.META_ERROR, failure.error());
        metadata.put(ContextKeys.META_FIELD, owner.parentFieldName());
        metadata.put(ContextKeys.META_STEP, step.getName());
        metadata.put(ContextKeys.META_AWAITING, ContextKeys.AWAITING_RETRY);
        return ActionResult.needsInput("I couldn't finish creating the " + owner.entityName() + ": " + failure.error()
                + ". Would you like to try again?", metadata);
    }

    /** Points the cursor at the step that started the subflow. The frame stays on the stack. */
    void returnToParentCursor(WorkflowContext ctx) {
        StackFrame frame = ctx.getWorkflowStack().peek().orElseThrow(() -> new EntityFlowException(
                EntityFlowErrorCode.INTERNAL_ERROR, "Subflow finished without a parent frame"));
        ctx.setCurrentWorkflow(frame.workflow());
        ctx.setCurrentStep(frame.step());
    }

    String stepPrefix(WorkflowContext ctx) {
        Optional<SubflowSlot.ActiveSubflow> active = ctx.activeSubflowSlot();
        if (active.isPresent() && active.get().workflowId().equals(ctx.getCurrentWorkflow())
                && active.get().owns(ctx.getCurrentStep())) {
            return active.get().stepPrefix();
        }
        Optional<StackFrame> top = ctx.getWorkflowStack().peek();
        if (top.isPresent() && top.get().activeSubflow() instanceof SubflowSlot.ActiveSubflow outer
                && outer.owns(ctx.getCurrentStep())) {
            return outer.stepPrefix();
        }
        return "";
    }
}
