package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.audit.ResolutionAuditService;
import com.github.salilvnair.entityflow.audit.ResolutionAuditStage;
import com.github.salilvnair.entityflow.engine.constants.ContextKeys;
import com.github.salilvnair.entityflow.engine.context.FieldResolutionState;
import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import com.github.salilvnair.entityflow.engine.model.ActionResult;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;
import com.github.salilvnair.entityflow.engine.subflow.SubflowOrchestrator;
import com.github.salilvnair.entityflow.engine.subflow.SubflowOutcome;
import com.github.salilvnair.entityflow.engine.workflow.WorkflowRunner;
import com.github.salilvnair.entityflow.intent.IntentInterpretation;
import com.github.salilvnair.entityflow.intent.IntentInterpreter;
import com.github.salilvnair.entityflow.intent.ItemExtractionHints;
import com.github.salilvnair.entityflow.store.EntityQuery;
import com.github.salilvnair.entityflow.store.EntityRecord;
import com.github.salilvnair.entityflow.store.EntityStore;
import com.github.salilvnair.entityflow.store.EntityStoreRegistry;
import com.github.salilvnair.entityflow.util.JsonUtil;
import com.github.salilvnair.entityflow.util.TextUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a list of entity references, e.g. invoice line items. Items that exist are
 * validated in one pass; missing ones are created one at a time after a single confirmation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchEntityResolver {

    private static final List<String> FALLBACK_IDENTIFIER_KEYS = List.of("name", "item", "product", "title", "label");

    private final EntityStoreRegistry stores;
    private final IntentInterpreter interpreter;
    private final SubflowOrchestrator subflows;
    private final WorkflowRunner runner;
    private final EntityCreationService creationService;
    private final ItemNameExtractor itemNames;
    private final FriendlyNameResolver friendlyNames;
    private final ResolutionAuditService audit;
    private final CustomResolverRegistry customResolvers;

    public ActionResult resolveBatch(String field, ResolutionConfig config, List<?> items, WorkflowContext ctx) {
        WorkflowContext snapshot = ctx.copy();
        try {
            return doResolveBatch(field, config, items, ctx);
        } catch (EntityFlowException e) {
            if (e.is(EntityFlowErrorCode.CONFIGURATION_ERROR)) {
                ctx.restoreFrom(snapshot);
                log.error("Cannot resolve batch field {}: {}", field, e.getMessage());
                audit(ResolutionAuditStage.RESOLUTION_FAILED, ctx, field, Map.of("error", e.getMessage()));
                return ActionResult.failure(e.getMessage());
            }
            return retry(field, config, ctx, snapshot, e);
        } catch (RuntimeException e) {
            return retry(field, config, ctx, snapshot, e);
        }
    }

    private ActionResult doResolveBatch(String field, ResolutionConfig config, List<?> items, WorkflowContext ctx) {
        if (config.hasCustomResolver()) {
            CustomEntityResolver custom = customResolvers.require(config.getResolver());
            audit(ResolutionAuditStage.DELEGATED_TO_CUSTOM_RESOLVER, ctx, field, Map.of("resolver", custom.id()));
            return custom.resolveBatch(field, config, items, ctx);
        }
        EntityStore store = stores.require(config.getModel());

        if (subflows.isRunning(field, ctx)) {
            ActionResult progress = runner.runSubflow(ctx);
            if (!subflows.hasCompleted(field, ctx)) {
                return progress;
            }
        }
        if (subflows.hasCompleted(field, ctx)) {
            return onSubflowCompleted(field, config, store, ctx);
        }

        FieldResolutionState state = ctx.fieldState(field);
        if (state instanceof FieldResolutionState.AwaitingBatchConfirm pending) {
            return continueConfirmation(field, config, store, pending, ctx);
        }
        if (state instanceof FieldResolutionState.CreatingViaSubflow creating && creating.batch()) {
            // the subflow for the current item was abandoned; ask again for what is left
            List<Map<String, Object>> remaining = creating.missing().subList(creating.index(), creating.missing().size());
            return askToCreate(field, config, creating.validated(), remaining, ctx);
        }
        ctx.clearFieldState(field);
        return partitionAndResolve(field, config, store, items, ctx);
    }

    // ---------------------------------------------------------------- partition

    public BatchPartition partition(ResolutionConfig config, EntityStore store, List<?> items) {
        List<Map<String, Object>> validated = new ArrayList<>();
        List<Map<String, Object>> missing = new ArrayList<>();
        for (Object raw : items == null ? List.of() : items) {
            Map<String, Object> item = normalizeItem(raw, config);
            String identifier = itemIdentifier(item, config);
            if (identifier == null) {
                missing.add(item);
                continue;
            }
            Optional<EntityRecord> found = store.findOne(
                    EntityQuery.exact(config.getFilters(), config.effectiveSearchFields(), identifier));
            if (found.isPresent()) {
                validated.add(mergeFound(found.get(), item, config));
            } else {
                missing.add(item);
            }
        }
        return new BatchPartition(validated, missing);
    }

    private ActionResult partitionAndResolve(String field,
                                             ResolutionConfig config,
                                             EntityStore store,
                                             List<?> items,
                                             WorkflowContext ctx) {
        BatchPartition partition = partition(config, store, items);
        audit(ResolutionAuditStage.BATCH_PARTITIONED, ctx, field,
                Map.of("validated", partition.validated().size(), "missing", partition.missing().size()));
        if (partition.missing().isEmpty()) {
            return finalizeBatch(field, config, partition.validated(), ctx,
                    "All " + friendlyName(field, config) + " found");
        }
        List<Map<String, Object>> missing = dedupe(partition.missing(), config);
        if (config.asksBeforeCreate()) {
            return askToCreate(field, config, partition.validated(), missing, ctx);
        }
        return createAllAutomatically(field, config, store, partition.validated(), missing, ctx);
    }

    Map<String, Object> normalizeItem(Object raw, ResolutionConfig config) {
        Map<String, Object> item = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> item.put(String.valueOf(k), v));
        } else if (raw != null) {
            item.put(config.itemIdentifierKey(), TextUtil.asText(raw));
        }
        item.putIfAbsent(config.getQuantityField(), 1);
        return item;
    }

    String itemIdentifier(Map<String, Object> item, ResolutionConfig config) {
        List<String> keys = new ArrayList<>();
        if (config.getIdentifierField() != null) {
            keys.add(config.getIdentifierField());
        }
        keys.addAll(config.getSearchFields());
        keys.addAll(FALLBACK_IDENTIFIER_KEYS);
        for (String key : keys) {
            Object value = item.get(key);
            if (!(value instanceof Map<?, ?>) && !(value instanceof List<?>)) {
                String text = TextUtil.asText(value);
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    /** Base fields, then include fields the user did not supply, then the user's own values. */
    private Map<String, Object> mergeFound(EntityRecord entity, Map<String, Object> item, ResolutionConfig config) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (String base : config.getBaseFields()) {
            Object value = entity.value(base);
            if (value != null) {
                merged.put(base, value);
            }
        }
        for (String include : config.getIncludeFields()) {
            if (!item.containsKey(include) && entity.value(include) != null) {
                merged.put(include, entity.value(include));
            }
        }
        merged.putAll(item);
        return merged;
    }

    private List<Map<String, Object>> dedupe(List<Map<String, Object>> missing, ResolutionConfig config) {
        Map<String, Map<String, Object>> byName = new LinkedHashMap<>();
        String quantityKey = config.getQuantityField();
        for (Map<String, Object> item : missing) {
            String key = displayName(item, config).toLowerCase(Locale.ROOT);
            Map<String, Object> existing = byName.get(key);
            if (existing == null) {
                byName.put(key, JsonUtil.copyMap(item));
            } else if (existing.get(quantityKey) instanceof Number a && item.get(quantityKey) instanceof Number b) {
                existing.put(quantityKey, sumQuantities(a, b));
            }
        }
        return new ArrayList<>(byName.values());
    }

    /** Whole sums come back as {@code Long}, the type session JSON reads integers into. */
    static Number sumQuantities(Number a, Number b) {
        BigDecimal sum = new BigDecimal(a.toString()).add(new BigDecimal(b.toString()));
        BigDecimal whole = sum.stripTrailingZeros();
        if (whole.scale() > 0 || whole.precision() - whole.scale() > 18) {
            return sum;
        }
        return whole.longValueExact();
    }

    // ---------------------------------------------------------------- confirmation

    private ActionResult askToCreate(String field,
                                     ResolutionConfig config,
                                     List<Map<String, Object>> validated,
                                     List<Map<String, Object>> missing,
                                     WorkflowContext ctx) {
        ctx.updateFieldState(field, new FieldResolutionState.AwaitingBatchConfirm(validated, missing));
        audit(ResolutionAuditStage.BATCH_CONFIRMATION_REQUESTED, ctx, field, Map.of("missing", missing.size()));
        return ActionResult.needsInput(missingListMessage(field, config, missing)
                        + "\nWould you like to create them? (yes/no)",
                confirmationMetadata(field, config, missing));
    }

    String missingListMessage(String field, ResolutionConfig config, List<Map<String, Object>> missing) {
        StringBuilder message = new StringBuilder("The following ")
                .append(missing.size()).append(' ')
                .append(friendlyName(field, config)).append(" don't exist:\n\n");
        for (Map<String, Object> item : missing) {
            message.append("• ").append(displayName(item, config))
                    .append(" (qty: ").append(item.getOrDefault(config.getQuantityField(), 1)).append(")\n");
        }
        return message.toString();
    }

    private ActionResult continueConfirmation(String field,
                                              ResolutionConfig config,
                                              EntityStore store,
                                              FieldResolutionState.AwaitingBatchConfirm pending,
                                              WorkflowContext ctx) {
        String text = ctx.lastUserMessage();
        IntentInterpretation reply = interpreter.interpretConfirmation(text);
        switch (reply.intent()) {
            case CONFIRM -> {
                ctx.clearFieldState(field);
                return createFrom(field, config, store, pending.validated(), pending.missing(), 0, ctx);
            }
            case DECLINE -> {
                ctx.clearFieldState(field);
                audit(ResolutionAuditStage.CREATION_DECLINED, ctx, field, Map.of("missing", pending.missing().size()));
                return ActionResult.failure(TextUtil.capitalize(friendlyName(field, config)) + " creation cancelled by user");
            }
            case MODIFY -> {
                List<Map<String, Object>> previous = new ArrayList<>(pending.validated());
                previous.addAll(pending.missing());
                List<Map<String, Object>> replacement = interpreter.extractItems(text,
                        new ItemExtractionHints(config.itemIdentifierKey(), config.getQuantityField(), previous));
                if (replacement.isEmpty()) {
                    return ActionResult.needsInput("I couldn't work out the new list. Please list the "
                                    + friendlyName(field, config) + " again, or reply yes/no.",
                            confirmationMetadata(field, config, pending.missing()));
                }
                ctx.clearFieldState(field);
                ctx.getCollectedData().remove(field);
                audit(ResolutionAuditStage.BATCH_MODIFIED, ctx, field, Map.of("items", replacement.size(), "source", reply.source()));
                return partitionAndResolve(field, config, store, replacement, ctx);
            }
            default -> {
                return ActionResult.needsInput(missingListMessage(field, config, pending.missing())
                                + "\nPlease reply 'yes' to create them, 'no' to cancel, or tell me what to change.",
                        confirmationMetadata(field, config, pending.missing()));
            }
        }
    }

    // ---------------------------------------------------------------- creation

    private ActionResult createFrom(String field,
                                    ResolutionConfig config,
                                    EntityStore store,
                                    List<Map<String, Object>> validated,
                                    List<Map<String, Object>> missing,
                                    int index,
                                    WorkflowContext ctx) {
        List<Map<String, Object>> resolved = new ArrayList<>(validated);
        if (!subflows.canStart(config)) {
            return createEach(field, config, store, resolved, missing.subList(index, missing.size()), ctx,
                    "All " + friendlyName(field, config) + " resolved");
        }
        if (index >= missing.size()) {
            return finalizeBatch(field, config, resolved, ctx, "All " + friendlyName(field, config) + " resolved");
        }
        Map<String, Object> item = missing.get(index);
        String name = displayName(item, config);
        ctx.updateFieldState(field, new FieldResolutionState.CreatingViaSubflow(name, index, resolved, missing, true));
        ActionResult started = subflows.start(field, config, name, passThrough(item, config), ctx, true);
        if (subflows.hasCompleted(field, ctx)) {
            return onSubflowCompleted(field, config, store, ctx);
        }
        if (!subflows.isRunning(field, ctx)) {
            ctx.updateFieldState(field,
                    new FieldResolutionState.AwaitingBatchConfirm(resolved, missing.subList(index, missing.size())));
        }
        return started;
    }

    private ActionResult onSubflowCompleted(String field, ResolutionConfig config, EntityStore store, WorkflowContext ctx) {
        if (!(ctx.fieldState(field) instanceof FieldResolutionState.CreatingViaSubflow creating)) {
            subflows.complete(field, ctx);
            throw new EntityFlowException(EntityFlowErrorCode.INTERNAL_ERROR,
                    "Subflow finished for " + field + " but no batch creation was in progress");
        }
        SubflowOutcome outcome = subflows.complete(field, ctx);
        List<Map<String, Object>> remaining = creating.missing().subList(creating.index(), creating.missing().size());
        if (!outcome.created()) {
            ctx.updateFieldState(field, new FieldResolutionState.AwaitingBatchConfirm(creating.validated(), remaining));
            return ActionResult.needsInput("I couldn't confirm that " + creating.identifier()
                            + " was created. Would you like to try again? (yes/no)",
                    confirmationMetadata(field, config, remaining));
        }
        Optional<EntityRecord> created = store.findById(outcome.entityId());
        Map<String, Object> pending = creating.pendingItem();
        pending.putIfAbsent(config.itemIdentifierKey(), creating.identifier());
        Map<String, Object> merged = subflows.mergeIntoItem(pending, outcome, config, created);
        audit(ResolutionAuditStage.ENTITY_CREATED, ctx, field, Map.of("id", outcome.entityId(), "via", "subflow"));

        List<Map<String, Object>> validated = new ArrayList<>(creating.validated());
        validated.add(merged);
        return createFrom(field, config, store, validated, creating.missing(), creating.index() + 1, ctx);
    }

    private ActionResult createAllAutomatically(String field,
                                                ResolutionConfig config,
                                                EntityStore store,
                                                List<Map<String, Object>> validated,
                                                List<Map<String, Object>> missing,
                                                WorkflowContext ctx) {
        return createEach(field, config, store, validated, missing, ctx,
                "Created " + missing.size() + " new " + friendlyName(field, config));
    }

    /**
     * Creates every item with defaults. Items created before a failure stay in the validated
     * list, so a retry only asks again for the ones that failed.
     */
    private ActionResult createEach(String field,
                                    ResolutionConfig config,
                                    EntityStore store,
                                    List<Map<String, Object>> validated,
                                    List<Map<String, Object>> missing,
                                    WorkflowContext ctx,
                                    String successMessage) {
        List<Map<String, Object>> resolved = new ArrayList<>(validated);
        List<Map<String, Object>> failed = new ArrayList<>();
        List<String> failedNames = new ArrayList<>();
        for (Map<String, Object> item : missing) {
            String name = displayName(item, config);
            try {
                EntityRecord created = creationService.createWithDefaults(store, config, name, passThrough(item, config), ctx);
                audit(ResolutionAuditStage.ENTITY_CREATED, ctx, field, Map.of("id", created.id(), "via", "defaults"));
                resolved.add(createdItem(created, item, name, config));
            } catch (RuntimeException e) {
                log.warn("Creation of {} '{}' failed: {}", config.getModel(), name, e.getMessage());
                failed.add(item);
                failedNames.add(name);
            }
        }
        if (failed.isEmpty()) {
            return finalizeBatch(field, config, resolved, ctx, successMessage);
        }
        ctx.updateFieldState(field, new FieldResolutionState.AwaitingBatchConfirm(resolved, failed));
        return ActionResult.needsInput("I couldn't create: " + String.join(", ", failedNames)
                        + ". Would you like to try again? (yes/no)",
                confirmationMetadata(field, config, failed));
    }

    private Map<String, Object> createdItem(EntityRecord created, Map<String, Object> item, String name, ResolutionConfig config) {
        Map<String, Object> resolved = new LinkedHashMap<>(item);
        resolved.putIfAbsent(config.itemIdentifierKey(), name);
        for (String include : config.getIncludeFields()) {
            if (JsonUtil.isBlank(resolved.get(include)) && created.value(include) != null) {
                resolved.put(include, created.value(include));
            }
        }
        resolved.put("id", created.id());
        return resolved;
    }

    private ActionResult finalizeBatch(String field,
                                       ResolutionConfig config,
                                       List<Map<String, Object>> validated,
                                       WorkflowContext ctx,
                                       String message) {
        List<Map<String, Object>> items = new ArrayList<>();
        validated.forEach(v -> items.add(JsonUtil.copyMap(v)));
        ctx.getCollectedData().put(field, items);
        for (String alias : legacyAliases(field)) {
            ctx.getCollectedData().remove(alias);
            ctx.forget(alias);
        }
        ctx.updateFieldState(field, new FieldResolutionState.Done(items.size()));
        audit(ResolutionAuditStage.BATCH_COMPLETED, ctx, field, Map.of("items", items.size()));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(field, items);
        return ActionResult.success(message, data);
    }

    // ---------------------------------------------------------------- helpers

    private List<String> legacyAliases(String field) {
        return List.of(field + "_validated", "validated_" + field, field + "_missing");
    }

    private Map<String, Object> passThrough(Map<String, Object> item, ResolutionConfig config) {
        Map<String, Object> fields = new LinkedHashMap<>(item);
        fields.remove(config.itemIdentifierKey());
        fields.remove("id");
        return fields;
    }

    private String displayName(Map<String, Object> item, ResolutionConfig config) {
        return itemNames.extract(item, config.itemIdentifierKey(), friendlyNames.entityName(config));
    }

    private String friendlyName(String field, ResolutionConfig config) {
        return friendlyNames.friendlyName(field, config);
    }

    private Map<String, Object> confirmationMetadata(String field, ResolutionConfig config, List<Map<String, Object>> missing) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ContextKeys.META_FIELD, field);
        metadata.put(ContextKeys.META_AWAITING, ContextKeys.AWAITING_BATCH_CONFIRMATION);
        metadata.put(ContextKeys.META_MISSING, missing.stream().map(item -> displayName(item, config)).toList());
        return metadata;
    }

    private ActionResult retry(String field, ResolutionConfig config, WorkflowContext ctx, WorkflowContext snapshot, RuntimeException e) {
        log.error("Batch resolution of field {} failed, rolling back this turn", field, e);
        ctx.restoreFrom(snapshot);
        String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        audit(ResolutionAuditStage.RESOLUTION_FAILED, ctx, field, Map.of("error", error));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ContextKeys.META_FIELD, field);
        metadata.put(ContextKeys.META_AWAITING, ContextKeys.AWAITING_RETRY);
        metadata.put(ContextKeys.META_ERROR, error);
        return ActionResult.needsInput("Something went wrong while checking the " + friendlyName(field, config)
                + ". Would you like to try again?", metadata);
    }

    private void audit(ResolutionAuditStage stage, WorkflowContext ctx, String field, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field);
        payload.putAll(extra);
        audit.audit(stage, ctx.getSessionId(), payload);
    }
}
