package com.github.salilvnair.entityflow.engine.subflow;

import com.github.salilvnair.entityflow.audit.ResolutionAuditService;
import com.github.salilvnair.entityflow.audit.ResolutionAuditStage;
import com.github.salilvnair.entityflow.engine.constants.ContextKeys;
import com.github.salilvnair.entityflow.engine.context.StackFrame;
import com.github.salilvnair.entityflow.engine.context.SubflowSlot;
import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import com.github.salilvnair.entityflow.engine.model.ActionResult;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;
import com.github.salilvnair.entityflow.engine.resolver.FriendlyNameResolver;
import com.github.salilvnair.entityflow.engine.workflow.WorkflowDefinition;
import com.github.salilvnair.entityflow.engine.workflow.WorkflowRegistry;
import com.github.salilvnair.entityflow.engine.workflow.WorkflowRunner;
import com.github.salilvnair.entityflow.store.EntityRecord;
import com.github.salilvnair.entityflow.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Starts nested creation workflows and folds their result back into the parent. While a
 * subflow runs, {@code collectedData} holds only the subflow's own fields; the parent's data
 * waits in the pushed {@link StackFrame}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubflowOrchestrator {

    private static final Pattern PRICE_LIKE = Pattern.compile("price|cost|fee|rate|charge");

    private final WorkflowRegistry workflowRegistry;
    private final WorkflowRunner runner;
    private final FriendlyNameResolver friendlyNames;
    private final ResolutionAuditService audit;

    public boolean canStart(ResolutionConfig config) {
        return config.hasSubflow() && workflowRegistry.contains(config.getSubflow());
    }

    public ActionResult start(String field,
                              ResolutionConfig config,
                              String identifier,
                              Map<String, Object> passThrough,
                              WorkflowContext ctx,
                              boolean batch) {
        WorkflowDefinition definition = workflowRegistry.require(config.getSubflow());
        if (ctx.inSubflow() && !ctx.subflowOwnsCurrentStep()) {
            throw new EntityFlowException(EntityFlowErrorCode.INTERNAL_ERROR,
                    "A finished subflow must be completed before another one starts");
        }
        String entityName = friendlyNames.entityName(config);
        String stepPrefix = stepPrefix(entityName, ctx.getCurrentWorkflow());

        Map<String, Object> parentData = JsonUtil.copyMap(ctx.getCollectedData());
        if (batch) {
            for (String stale : definition.entityFields()) {
                ctx.forget(stale);
                parentData.remove(stale);
            }
        }
        ctx.getWorkflowStack().push(new StackFrame(
                ctx.getCurrentWorkflow(), ctx.getCurrentStep(), ctx.getActiveSubflow(), parentData));

        Map<String, Object> fresh = new LinkedHashMap<>();
        fresh.put(definition.identifierField(), identifier);
        ctx.extractedData(field).forEach(fresh::putIfAbsent);
        if (passThrough != null) {
            passThrough.forEach((k, v) -> {
                if (v != null && !k.equals(definition.identifierField())) {
                    fresh.put(k, v);
                }
            });
        }
        ctx.setCollectedData(fresh);
        ctx.setActiveSubflow(new SubflowSlot.ActiveSubflow(definition.workflowId(), field, entityName, stepPrefix));
        ctx.setCurrentWorkflow(definition.workflowId());
        ctx.setCurrentStep(definition.firstStep(stepPrefix));
        log.info("Started subflow {} for field {} with prefix {}", definition.workflowId(), field, stepPrefix);
        audit.audit(ResolutionAuditStage.SUBFLOW_STARTED, ctx.getSessionId(), Map.of(
                "field", field, "workflow", definition.workflowId(), "stepPrefix", stepPrefix, "batch", batch));

        ActionResult result;
        try {
            result = runner.runSubflow(ctx);
        } catch (RuntimeException e) {
            log.error("Subflow {} failed to start", definition.workflowId(), e);
            abort(ctx);
            return startFailure(field, entityName, e.getMessage(), ctx);
        }
        if (result instanceof ActionResult.Failure failure) {
            abort(ctx);
            return startFailure(field, entityName, failure.error(), ctx);
        }
        return result;
    }

    /** The subflow for {@code field} still owns the cursor. */
    public boolean isRunning(String field, WorkflowContext ctx) {
        return activeFor(field, ctx).map(a -> a.owns(ctx.getCurrentStep())).orElse(false);
    }

    /** The subflow for {@code field} has handed the cursor back but has not been folded in yet. */
    public boolean hasCompleted(String field, WorkflowContext ctx) {
        return activeFor(field, ctx).map(a -> !a.owns(ctx.getCurrentStep())).orElse(false);
    }

    public SubflowOutcome complete(String field, WorkflowContext ctx) {
        SubflowSlot.ActiveSubflow active = activeFor(field, ctx).orElseThrow(() -> new EntityFlowException(
                EntityFlowErrorCode.INTERNAL_ERROR, "No subflow is active for " + field));
        Map<String, Object> subflowData = JsonUtil.copyMap(ctx.getCollectedData());
        Object entityId = consumeCreatedId(field, active, ctx, subflowData);
        restoreParent(ctx);
        log.info("Subflow {} for field {} completed with id {}", active.workflowId(), field, entityId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field);
        payload.put("workflow", active.workflowId());
        payload.put("entityId", entityId);
        audit.audit(ResolutionAuditStage.SUBFLOW_COMPLETED, ctx.getSessionId(), payload);
        return new SubflowOutcome(entityId, subflowData, active);
    }

    /** Drops the innermost subflow and puts the parent back exactly as it was. */
    public void abort(WorkflowContext ctx) {
        if (ctx.getWorkflowStack().isEmpty()) {
            ctx.setActiveSubflow(SubflowSlot.none());
            return;
        }
        restoreParent(ctx);
    }

    /**
     * Folds a finished subflow into the pending item. Values the user typed during the subflow
     * win; the stored entity only fills gaps.
     */
    public Map<String, Object> mergeIntoItem(Map<String, Object> pendingItem,
                                             SubflowOutcome outcome,
                                             ResolutionConfig config,
                                             Optional<EntityRecord> created) {
        Map<String, Object> item = JsonUtil.copyMap(pendingItem);
        Set<String> wanted = new LinkedHashSet<>(config.getRequiredItemFields());
        wanted.addAll(config.getIncludeFields());
        for (String key : wanted) {
            Object value = outcome.subflowData().get(key);
            if (!JsonUtil.isBlank(value)) {
                item.put(key, value);
            }
        }
        outcome.subflowData().forEach((key, value) -> {
            if (!JsonUtil.isBlank(value) && PRICE_LIKE.matcher(key.toLowerCase(Locale.ROOT)).find()) {
                item.put(key, value);
            }
        });
        created.ifPresent(entity -> {
            for (String key : config.getIncludeFields()) {
                if (JsonUtil.isBlank(item.get(key)) && entity.value(key) != null) {
                    item.put(key, entity.value(key));
                }
            }
            for (String key : config.getBaseFields()) {
                if (!"id".equals(key) && JsonUtil.isBlank(item.get(key)) && entity.value(key) != null) {
                    item.put(key, entity.value(key));
                }
            }
        });
        item.put("id", outcome.entityId());
        return item;
    }

    String stepPrefix(String entityName, String parentWorkflow) {
        String parent = parentWorkflow == null ? "" : parentWorkflow.replaceAll("(?i)[_\\-\\s]?workflow$", "");
        if (parent.isBlank()) {
            parent = "workflow";
        }
        return (entityName + "_" + parent).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    }

    private Optional<SubflowSlot.ActiveSubflow> activeFor(String field, WorkflowContext ctx) {
        return ctx.activeSubflowSlot().filter(a -> a.servesField(field));
    }

    private Object consumeCreatedId(String field,
                                    SubflowSlot.ActiveSubflow active,
                                    WorkflowContext ctx,
                                    Map<String, Object> subflowData) {
        String entityKey = active.entityName().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        Object id = null;
        for (String slot : new String[]{ContextKeys.idSlot(field), ContextKeys.idSlot(entityKey), ContextKeys.ENTITY_ID}) {
            Object value = ctx.forget(slot);
            if (id == null && value != null) {
                id = value;
            }
        }
        return id != null ? id : subflowData.get("id");
    }

    private void restoreParent(WorkflowContext ctx) {
        StackFrame frame = ctx.getWorkflowStack().pop().orElseThrow(() -> new EntityFlowException(
                EntityFlowErrorCode.INTERNAL_ERROR, "Workflow stack is empty"));
        ctx.setCollectedData(frame.restoredCollectedData());
        ctx.setActiveSubflow(frame.activeSubflow());
        ctx.setCurrentWorkflow(frame.workflow());
        ctx.setCurrentStep(frame.step());
    }

    private ActionResult startFailure(String field, String entityName, String error, WorkflowContext ctx) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field);
        payload.put("error", error);
        audit.audit(ResolutionAuditStage.SUBFLOW_FAILED, ctx.getSessionId(), payload);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ContextKeys.META_ERROR, error);
        metadata.put(ContextKeys.META_FIELD, field);
        metadata.put(ContextKeys.META_AWAITING, ContextKeys.AWAITING_RETRY);
        return ActionResult.needsInput("I couldn't start creating the " + entityName.toLowerCase(Locale.ROOT)
                + ". Would you like to try again?", metadata);
    }
}
