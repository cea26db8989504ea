package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.audit.ResolutionAuditService;
import com.github.salilvnair.entityflow.audit.ResolutionAuditStage;
import com.github.salilvnair.entityflow.engine.constants.ContextKeys;
import com.github.salilvnair.entityflow.engine.context.FieldResolutionState;
import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import com.github.salilvnair.entityflow.engine.model.ActionResult;
import com.github.salilvnair.entityflow.engine.model.Candidate;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;
import com.github.salilvnair.entityflow.engine.ranking.DuplicateRanker;
import com.github.salilvnair.entityflow.engine.subflow.SubflowOrchestrator;
import com.github.salilvnair.entityflow.engine.subflow.SubflowOutcome;
import com.github.salilvnair.entityflow.engine.workflow.WorkflowRunner;
import com.github.salilvnair.entityflow.intent.IntentInterpretation;
import com.github.salilvnair.entityflow.intent.IntentInterpreter;
import com.github.salilvnair.entityflow.store.EntityQuery;
import com.github.salilvnair.entityflow.store.EntityRecord;
import com.github.salilvnair.entityflow.store.EntityStore;
import com.github.salilvnair.entityflow.store.EntityStoreRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves one field to a stored entity across as many turns as it takes. Each call picks up
 * from the field's {@link FieldResolutionState}: searching, waiting for a duplicate choice,
 * waiting for a create confirmation, or folding in a finished creation subflow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityResolver {

    private final EntityStoreRegistry stores;
    private final DuplicateRanker ranker;
    private final IntentInterpreter interpreter;
    private final IdentifierExtractor identifierExtractor;
    private final EntityCreationService creationService;
    private final SubflowOrchestrator subflows;
    private final WorkflowRunner runner;
    private final FriendlyNameResolver friendlyNames;
    private final ResolutionAuditService audit;
    private final CustomResolverRegistry customResolvers;

    public ActionResult resolve(String field, ResolutionConfig config, Object identifier, WorkflowContext ctx) {
        WorkflowContext snapshot = ctx.copy();
        try {
            return doResolve(field, config, identifier, ctx);
        } catch (EntityFlowException e) {
            if (e.is(EntityFlowErrorCode.CONFIGURATION_ERROR)) {
                ctx.restoreFrom(snapshot);
                log.error("Cannot resolve field {}: {}", field, e.getMessage());
                audit(ResolutionAuditStage.RESOLUTION_FAILED, ctx, field, Map.of("error", e.getMessage()));
                return ActionResult.failure(e.getMessage());
            }
            return retry(field, config, ctx, snapshot, e);
        } catch (RuntimeException e) {
            return retry(field, config, ctx, snapshot, e);
        }
    }

    private ActionResult doResolve(String field, ResolutionConfig config, Object identifier, WorkflowContext ctx) {
        if (config.hasCustomResolver()) {
            CustomEntityResolver custom = customResolvers.require(config.getResolver());
            audit(ResolutionAuditStage.DELEGATED_TO_CUSTOM_RESOLVER, ctx, field, Map.of("resolver", custom.id()));
            return custom.resolve(field, config, identifier, ctx);
        }
        EntityStore store = stores.require(config.getModel());

        if (subflows.isRunning(field, ctx)) {
            ActionResult progress = runner.runSubflow(ctx);
            if (!subflows.hasCompleted(field, ctx)) {
                return progress;
            }
        }
        if (subflows.hasCompleted(field, ctx)) {
            return finishSubflow(field, config, store, ctx);
        }

        String searchValue = identifierExtractor.searchValue(field, config, identifier, ctx);
        FieldResolutionState state = ctx.fieldState(field);
        if (state instanceof FieldResolutionState.AwaitingDuplicateChoice pending) {
            return handleDuplicateChoice(field, config, store, pending, ctx);
        }
        if (state instanceof FieldResolutionState.AwaitingCreateConfirm pending) {
            return continueCreation(field, config, store, pending, ctx);
        }
        ctx.clearFieldState(field);

        if (searchValue == null) {
            return ActionResult.needsInput("Which " + entityName(config).toLowerCase(Locale.ROOT) + " should I use?",
                    metadata(field, ContextKeys.AWAITING_FIELD_VALUE, Map.of(ContextKeys.META_ERROR, "missing_identifier")));
        }
        audit(ResolutionAuditStage.RESOLUTION_STARTED, ctx, field, Map.of("identifier", searchValue));

        Optional<EntityRecord> exact = store.findOne(
                EntityQuery.exact(config.getFilters(), config.effectiveSearchFields(), searchValue));
        if (exact.isPresent()) {
            audit(ResolutionAuditStage.EXACT_MATCH_FOUND, ctx, field, Map.of("id", exact.get().id()));
            return adopt(field, config, exact.get(), ctx, "Using existing " + entityName(config) + ": " + searchValue);
        }

        if (config.ranksDuplicates()) {
            List<Candidate> candidates = ranker.findSimilar(store, config, searchValue);
            if (!candidates.isEmpty()) {
                ctx.updateFieldState(field, new FieldResolutionState.AwaitingDuplicateChoice(searchValue, candidates));
                audit(ResolutionAuditStage.DUPLICATES_PRESENTED, ctx, field, Map.of("count", candidates.size()));
                return ActionResult.needsInput(presentDuplicates(config, candidates),
                        metadata(field, ContextKeys.AWAITING_DUPLICATE_CHOICE,
                                Map.of(ContextKeys.META_CANDIDATES, candidates.stream().map(Candidate::id).toList())));
            }
        }
        return startCreation(field, config, store, searchValue, ctx);
    }

    // ---------------------------------------------------------------- duplicates

    private ActionResult handleDuplicateChoice(String field,
                                               ResolutionConfig config,
                                               EntityStore store,
                                               FieldResolutionState.AwaitingDuplicateChoice pending,
                                               WorkflowContext ctx) {
        List<Candidate> candidates = pending.candidates();
        IntentInterpretation choice = interpreter.interpretDuplicateChoice(ctx.lastUserMessage(), candidates.size());
        switch (choice.intent()) {
            case USE -> {
                if (choice.index() != null && choice.index() >= 0 && choice.index() < candidates.size()) {
                    Candidate chosen = candidates.get(choice.index());
                    ctx.clearFieldState(field);
                    EntityRecord entity = store.findById(chosen.id())
                            .orElseGet(() -> new EntityRecord(chosen.id(), chosen.fields()));
                    audit(ResolutionAuditStage.DUPLICATE_CHOSEN, ctx, field, Map.of("id", chosen.id(), "source", choice.source()));
                    return adopt(field, config, entity, ctx,
                            "Using existing " + entityName(config) + ": " + label(chosen));
                }
            }
            case CREATE -> {
                ctx.clearFieldState(field);
                return startCreation(field, config, store, pending.identifier(), ctx);
            }
            default -> {
            }
        }
        return ActionResult.needsInput("I didn't understand that. Please reply with: " + duplicateOptions(candidates.size()),
                metadata(field, ContextKeys.AWAITING_DUPLICATE_CHOICE,
                        Map.of(ContextKeys.META_CANDIDATES, candidates.stream().map(Candidate::id).toList())));
    }

    String presentDuplicates(ResolutionConfig config, List<Candidate> candidates) {
        String entity = entityName(config);
        if (candidates.size() == 1) {
            Candidate only = candidates.get(0);
            return "Found existing " + entity + ": **" + label(only) + "** (Match: " + only.similarityScore() + "%)\n\n"
                    + "Reply 'use' or 'yes' to use it, or 'new' or 'create' to create a new one.";
        }
        StringBuilder message = new StringBuilder("Found ")
                .append(candidates.size()).append(" similar ")
                .append(friendlyNames.pluralize(entity.toLowerCase(Locale.ROOT))).append(":\n\n");
        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            message.append(i + 1).append(". **").append(label(candidate)).append("** (Match: ")
                    .append(candidate.similarityScore()).append("%)\n");
        }
        message.append("\nReply with a number to use it, or 'new' to create a new one.");
        return message.toString();
    }

    private String duplicateOptions(int count) {
        if (count == 1) {
            return "'use' or 'yes' to use the existing one, or 'new' or 'create' to create a new one.";
        }
        return "a number between 1 and " + count + " to use an existing one, or 'new' to create a new one.";
    }

    // ---------------------------------------------------------------- creation

    private ActionResult startCreation(String field,
                                       ResolutionConfig config,
                                       EntityStore store,
                                       String identifier,
                                       WorkflowContext ctx) {
        if (!config.asksBeforeCreate()) {
            return createAutomatically(field, config, store, identifier, ctx);
        }
        if (config.hasSubflow() && !subflows.canStart(config)) {
            log.warn("Subflow {} for field {} is not registered, creation will use defaults", config.getSubflow(), field);
        }
        ctx.updateFieldState(field, new FieldResolutionState.AwaitingCreateConfirm(identifier, subflows.canStart(config)));
        audit(ResolutionAuditStage.CREATE_CONFIRMATION_REQUESTED, ctx, field, Map.of("identifier", identifier));
        return ActionResult.needsInput(
                entityName(config) + " '" + identifier + "' doesn't exist. Would you like to create it? (yes/no)",
                metadata(field, ContextKeys.AWAITING_CREATE_CONFIRMATION, Map.of()));
    }

    private ActionResult continueCreation(String field,
                                          ResolutionConfig config,
                                          EntityStore store,
                                          FieldResolutionState.AwaitingCreateConfirm pending,
                                          WorkflowContext ctx) {
        IntentInterpretation reply = interpreter.interpretConfirmation(ctx.lastUserMessage());
        switch (reply.intent()) {
            case CONFIRM -> {
                ctx.clearFieldState(field);
                if (pending.identifier() == null || pending.identifier().isBlank()) {
                    return ActionResult.failure("Cannot create entity - identifier is missing");
                }
                if (pending.useSubflow() && subflows.canStart(config)) {
                    return startSubflow(field, config, store, pending.identifier(), ctx);
                }
                return createAutomatically(field, config, store, pending.identifier(), ctx);
            }
            case DECLINE -> {
                ctx.clearFieldState(field);
                audit(ResolutionAuditStage.CREATION_DECLINED, ctx, field, Map.of("identifier", String.valueOf(pending.identifier())));
                return ActionResult.failure(entityName(config) + " creation cancelled by user");
            }
            default -> {
                return ActionResult.needsInput("Please reply 'yes' to create " + entityName(config) + " '"
                                + pending.identifier() + "' or 'no' to cancel.",
                        metadata(field, ContextKeys.AWAITING_CREATE_CONFIRMATION, Map.of()));
            }
        }
    }

    private ActionResult startSubflow(String field,
                                      ResolutionConfig config,
                                      EntityStore store,
                                      String identifier,
                                      WorkflowContext ctx) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put(config.itemIdentifierKey(), identifier);
        ctx.updateFieldState(field, new FieldResolutionState.CreatingViaSubflow(identifier, 0, List.of(), List.of(item), false));
        ActionResult started = subflows.start(field, config, identifier, Map.of(), ctx, false);
        if (subflows.hasCompleted(field, ctx)) {
            return finishSubflow(field, config, store, ctx);
        }
        if (!subflows.isRunning(field, ctx)) {
            ctx.updateFieldState(field, new FieldResolutionState.AwaitingCreateConfirm(identifier, true));
        }
        return started;
    }

    private ActionResult finishSubflow(String field, ResolutionConfig config, EntityStore store, WorkflowContext ctx) {
        FieldResolutionState state = ctx.fieldState(field);
        String identifier = state instanceof FieldResolutionState.CreatingViaSubflow creating ? creating.identifier() : null;
        Map<String, Object> pending = state instanceof FieldResolutionState.CreatingViaSubflow creating
                ? creating.pendingItem()
                : new LinkedHashMap<>();
        SubflowOutcome outcome = subflows.complete(field, ctx);
        if (!outcome.created()) {
            ctx.updateFieldState(field, new FieldResolutionState.AwaitingCreateConfirm(identifier, true));
            return ActionResult.needsInput("I couldn't confirm that " + entityName(config) + " '" + identifier
                            + "' was created. Would you like to try again?",
                    metadata(field, ContextKeys.AWAITING_CREATE_CONFIRMATION, Map.of(ContextKeys.META_ERROR, "missing_entity_id")));
        }
        Optional<EntityRecord> created = store.findById(outcome.entityId());
        Map<String, Object> merged = subflows.mergeIntoItem(pending, outcome, config, created);
        Object value = config.getIncludeFields().isEmpty() ? outcome.entityId() : merged;
        ctx.getCollectedData().put(field, value);
        ctx.updateFieldState(field, new FieldResolutionState.Done(outcome.entityId()));
        audit(ResolutionAuditStage.ENTITY_CREATED, ctx, field, Map.of("id", outcome.entityId(), "via", "subflow"));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(field, value);
        data.put(ContextKeys.DATA_ENTITY, merged);
        return ActionResult.success(entityName(config) + " '" + (identifier == null ? outcome.entityId() : identifier)
                + "' created", data);
    }

    private ActionResult createAutomatically(String field,
                                             ResolutionConfig config,
                                             EntityStore store,
                                             String identifier,
                                             WorkflowContext ctx) {
        if (identifier == null || identifier.isBlank()) {
            return ActionResult.failure("Cannot create entity - identifier is missing");
        }
        EntityRecord created = creationService.createWithDefaults(store, config, identifier, ctx.extractedData(field), ctx);
        audit(ResolutionAuditStage.ENTITY_CREATED, ctx, field, Map.of("id", created.id(), "via", "defaults"));
        return adopt(field, config, created, ctx, entityName(config) + " '" + identifier + "' created");
    }

    // ---------------------------------------------------------------- helpers

    private ActionResult adopt(String field, ResolutionConfig config, EntityRecord entity, WorkflowContext ctx, String message) {
        Object value = project(entity, config);
        ctx.getCollectedData().put(field, value);
        ctx.updateFieldState(field, new FieldResolutionState.Done(entity.id()));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(field, value);
        data.put(ContextKeys.DATA_ENTITY, entity.asMap());
        return ActionResult.success(message, data);
    }

    /** Bare id, or id plus {@code includeFields} when the config asks for them. */
    Object project(EntityRecord entity, ResolutionConfig config) {
        if (config.getIncludeFields().isEmpty()) {
            return entity.id();
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        projected.put("id", entity.id());
        for (String include : config.getIncludeFields()) {
            projected.put(include, entity.value(include));
        }
        return projected;
    }

    private ActionResult retry(String field, ResolutionConfig config, WorkflowContext ctx, WorkflowContext snapshot, RuntimeException e) {
        log.error("Resolution of field {} failed, rolling back this turn", field, e);
        ctx.restoreFrom(snapshot);
        FieldResolutionState state = ctx.fieldState(field);
        if (state instanceof FieldResolutionState.AwaitingDuplicateChoice
                || state instanceof FieldResolutionState.AwaitingCreateConfirm) {
            ctx.clearFieldState(field);
        }
        String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        audit(ResolutionAuditStage.RESOLUTION_FAILED, ctx, field, Map.of("error", error));
        return ActionResult.needsInput("Something went wrong while resolving the " + entityName(config).toLowerCase(Locale.ROOT)
                        + ". Would you like to try again?",
                metadata(field, ContextKeys.AWAITING_RETRY, Map.of(ContextKeys.META_ERROR, error)));
    }

    private String label(Candidate candidate) {
        String matched = candidate.matchedValue();
        if (matched != null) {
            return matched;
        }
        Object name = candidate.fields().get("name");
        return name == null ? String.valueOf(candidate.id()) : String.valueOf(name);
    }

    private String entityName(ResolutionConfig config) {
        return friendlyNames.entityName(config);
    }

    private Map<String, Object> metadata(String field, String awaiting, Map<String, Object> extra) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ContextKeys.META_FIELD, field);
        metadata.put(ContextKeys.META_AWAITING, awaiting);
        metadata.putAll(extra);
        return metadata;
    }

    private void audit(ResolutionAuditStage stage, WorkflowContext ctx, String field, Map<String, Object> extra) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field);
        payload.putAll(extra);
        audit.audit(stage, ctx.getSessionId(), payload);
    }
}
