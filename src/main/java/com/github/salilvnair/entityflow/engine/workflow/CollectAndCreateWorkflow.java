package com.github.salilvnair.entityflow.engine.workflow;

import com.github.salilvnair.entityflow.engine.constants.ContextKeys;
import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.model.ActionResult;
import com.github.salilvnair.entityflow.store.EntityRecord;
import com.github.salilvnair.entityflow.store.EntityStore;
import com.github.salilvnair.entityflow.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creation subflow that asks for each missing required field, one per turn, and then
 * creates the entity. The new id is left in {@code entity_id}.
 */
@Slf4j
public class CollectAndCreateWorkflow implements WorkflowDefinition {

    public static final String COLLECT_STEP = "collect_details";
    public static final String CREATE_STEP = "create_entity";
    private static final String AWAITING_SUFFIX = "awaiting_field";

    private final String workflowId;
    private final String entityName;
    private final EntityStore store;
    private final List<String> requiredFields;
    private final Set<String> entityFields;
    private final String identifierField;

    public CollectAndCreateWorkflow(String workflowId,
                                    String entityName,
                                    EntityStore store,
                                    List<String> requiredFields,
                                    List<String> optionalFields,
                                    String identifierField) {
        this.workflowId = workflowId;
        this.entityName = entityName;
        this.store = store;
        this.requiredFields = List.copyOf(requiredFields);
        this.identifierField = identifierField == null ? "name" : identifierField;
        Set<String> fields = new LinkedHashSet<>(requiredFields);
        fields.addAll(optionalFields == null ? List.of() : optionalFields);
        this.entityFields = Set.copyOf(fields);
    }

    @Override
    public String workflowId() {
        return workflowId;
    }

    @Override
    public Set<String> entityFields() {
        return entityFields;
    }

    @Override
    public String identifierField() {
        return identifierField;
    }

    @Override
    public List<WorkflowStep> steps(String stepPrefix) {
        String collect = WorkflowDefinition.stepName(stepPrefix, COLLECT_STEP);
        String create = WorkflowDefinition.stepName(stepPrefix, CREATE_STEP);
        String awaitingKey = WorkflowDefinition.stepName(stepPrefix, AWAITING_SUFFIX);
        return List.of(
                WorkflowStep.builder()
                        .name(collect)
                        .executor(ctx -> collect(ctx, collect, awaitingKey))
                        .onSuccess(create)
                        .build(),
                WorkflowStep.builder()
                        .name(create)
                        .executor(ctx -> create(ctx, awaitingKey))
                        .build()
        );
    }

    private ActionResult collect(WorkflowContext ctx, String stepName, String awaitingKey) {
        Object awaiting = ctx.get(awaitingKey);
        if (awaiting != null) {
            String answer = ctx.lastUserMessage().trim();
            if (!answer.isEmpty()) {
                ctx.getCollectedData().put(String.valueOf(awaiting), parseValue(answer));
                ctx.forget(awaitingKey);
            }
        }
        Optional<String> missing = requiredFields.stream()
                .filter(f -> JsonUtil.isBlank(ctx.getCollectedData().get(f)))
                .findFirst();
        if (missing.isEmpty()) {
            return ActionResult.success("All " + entityName + " details collected");
        }
        ctx.set(awaitingKey, missing.get());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ContextKeys.META_FIELD, missing.get());
        metadata.put(ContextKeys.META_STEP, stepName);
        metadata.put(ContextKeys.META_AWAITING, ContextKeys.AWAITING_FIELD_VALUE);
        Object name = ctx.getCollectedData().get(identifierField);
        String subject = name == null ? "the new " + entityName : entityName + " '" + name + "'";
        return ActionResult.needsInput("What is the " + missing.get().replace('_', ' ') + " for " + subject + "?", metadata);
    }

    private ActionResult create(WorkflowContext ctx, String awaitingKey) {
        List<String> writable = store.listWritableFields();
        Map<String, Object> data = new LinkedHashMap<>();
        ctx.getCollectedData().forEach((k, v) -> {
            if (v != null && writable.contains(k)) {
                data.put(k, v);
            }
        });
        EntityRecord created = store.create(data);
        ctx.forget(awaitingKey);
        ctx.set(ContextKeys.ENTITY_ID, created.id());
        ctx.getCollectedData().put("id", created.id());
        log.info("Subflow {} created {} {}", workflowId, entityName, created.id());
        return ActionResult.success(entityName + " created", Map.of(ContextKeys.ENTITY_ID, created.id()));
    }

    private Object parseValue(String answer) {
        if (answer.matches("-?\\d+")) {
            try {
                return Long.valueOf(answer);
            } catch (NumberFormatException e) {
                return answer;
            }
        }
        String amount = answer.replaceFirst("^\\$\\s*", "");
        if (amount.matches("-?\\d+(\\.\\d+)?")) {
            return new BigDecimal(amount);
        }
        return answer;
    }
}
