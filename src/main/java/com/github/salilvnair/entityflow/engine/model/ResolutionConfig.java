package com.github.salilvnair.entityflow.engine.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Per-field resolution settings. Built fresh for each resolution call and never mutated.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ResolutionConfig {

    private final String model;

    @Singular
    private final List<String> searchFields;

    private final String identifierField;

    @Builder.Default
    private final String quantityField = "quantity";

    @Builder.Default
    private final boolean interactive = true;

    @Builder.Default
    private final boolean confirmBeforeCreate = true;

    @Builder.Default
    private final boolean checkDuplicates = false;

    @Builder.Default
    private final boolean askOnDuplicate = false;

    /** Scope predicate applied to every store query, e.g. {@code workspace_id = 7}. */
    @Singular
    private final Map<String, Object> filters;

    /** Identifier of the nested creation workflow, if creation is interactive. */
    private final String subflow;

    @Singular
    private final List<String> includeFields;

    @Builder.Default
    private final List<String> baseFields = List.of("id", "name");

    @Singular
    private final List<String> requiredItemFields;

    private final String displayName;

    /** Id of a {@code CustomEntityResolver} that handles this field instead of the store search. */
    private final String resolver;

    private final String friendlyName;

    @Singular
    private final Map<String, Object> defaults;

    public boolean hasSubflow() {
        return subflow != null && !subflow.isBlank();
    }

    public boolean hasCustomResolver() {
        return resolver != null && !resolver.isBlank();
    }

    public boolean asksBeforeCreate() {
        return confirmBeforeCreate || interactive;
    }

    public boolean ranksDuplicates() {
        return checkDuplicates && askOnDuplicate;
    }

    public List<String> effectiveSearchFields() {
        if (searchFields == null || searchFields.isEmpty()) {
            return List.of(identifierField == null ? "name" : identifierField);
        }
        return searchFields;
    }

    /** Key under which batch items carry their identifier. */
    public String itemIdentifierKey() {
        if (identifierField != null && !identifierField.isBlank()) {
            return identifierField;
        }
        return searchFields == null || searchFields.isEmpty() ? "name" : searchFields.get(0);
    }
}
