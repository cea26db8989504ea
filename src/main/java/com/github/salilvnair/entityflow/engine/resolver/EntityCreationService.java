package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;
import com.github.salilvnair.entityflow.store.EntityRecord;
import com.github.salilvnair.entityflow.store.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates an entity without asking the user anything: identifier, ownership and static defaults
 * are filled from what the store declares writable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityCreationService {

    private static final List<String> IDENTIFIER_FIELDS = List.of("name", "title", "label", "identifier");
    private static final List<String> WORKSPACE_FIELDS = List.of("workspace_id", "workspace");
    private static final List<String> CREATOR_FIELDS = List.of("created_by", "creator_id", "user_id");

    private final CreationDefaultsProvider defaultsProvider;

    public EntityRecord createWithDefaults(EntityStore store,
                                           ResolutionConfig config,
                                           String identifier,
                                           Map<String, Object> extraFields,
                                           WorkflowContext ctx) {
        List<String> writable = store.listWritableFields();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(identifierField(config, writable), identifier);
        if (extraFields != null) {
            extraFields.forEach((k, v) -> {
                if (v != null && writable.contains(k)) {
                    data.putIfAbsent(k, v);
                }
            });
        }
        firstWritable(WORKSPACE_FIELDS, writable).ifPresent(f ->
                defaultsProvider.workspaceId(ctx).ifPresent(v -> data.put(f, v)));
        firstWritable(CREATOR_FIELDS, writable).ifPresent(f ->
                defaultsProvider.creatorId(ctx).ifPresent(v -> data.put(f, v)));
        data.putAll(config.getDefaults());
        EntityRecord created = store.create(data);
        log.info("Created {} {} with fields {}", store.modelType(), created.id(), data.keySet());
        return created;
    }

    String identifierField(ResolutionConfig config, List<String> writable) {
        if (config.getIdentifierField() != null && !config.getIdentifierField().isBlank()) {
            return config.getIdentifierField();
        }
        return firstWritable(IDENTIFIER_FIELDS, writable).orElse("name");
    }

    private Optional<String> firstWritable(List<String> candidates, List<String> writable) {
        return candidates.stream().filter(writable::contains).findFirst();
    }
}
