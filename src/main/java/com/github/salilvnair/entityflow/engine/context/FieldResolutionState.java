package com.github.salilvnair.entityflow.engine.context;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.github.salilvnair.entityflow.engine.model.Candidate;
import com.github.salilvnair.entityflow.util.JsonUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Where a field's resolution stands between turns.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FieldResolutionState.Idle.class, name = "idle"),
        @JsonSubTypes.Type(value = FieldResolutionState.AwaitingDuplicateChoice.class, name = "awaiting_duplicate_choice"),
        @JsonSubTypes.Type(value = FieldResolutionState.AwaitingCreateConfirm.class, name = "awaiting_create_confirm"),
        @JsonSubTypes.Type(value = FieldResolutionState.AwaitingBatchConfirm.class, name = "awaiting_batch_confirm"),
        @JsonSubTypes.Type(value = FieldResolutionState.CreatingViaSubflow.class, name = "creating_via_subflow"),
        @JsonSubTypes.Type(value = FieldResolutionState.Done.class, name = "done")
})
public sealed interface FieldResolutionState permits FieldResolutionState.Idle,
        FieldResolutionState.AwaitingDuplicateChoice,
        FieldResolutionState.AwaitingCreateConfirm,
        FieldResolutionState.AwaitingBatchConfirm,
        FieldResolutionState.CreatingViaSubflow,
        FieldResolutionState.Done {

    static FieldResolutionState idle() {
        return new Idle();
    }

    record Idle() implements FieldResolutionState {
    }

    record AwaitingDuplicateChoice(String identifier, List<Candidate> candidates) implements FieldResolutionState {
        public AwaitingDuplicateChoice {
            candidates = candidates == null ? List.of() : List.copyOf(candidates);
        }
    }

    record AwaitingCreateConfirm(String identifier, boolean useSubflow) implements FieldResolutionState {
    }

    record AwaitingBatchConfirm(List<Map<String, Object>> validated, List<Map<String, Object>> missing)
            implements FieldResolutionState {
        public AwaitingBatchConfirm {
            validated = copyItems(validated);
            missing = copyItems(missing);
        }
    }

    /**
     * {@code index} points into {@code missing}; for a single field {@code missing} holds one item.
     */
    record CreatingViaSubflow(String identifier,
                              int index,
                              List<Map<String, Object>> validated,
                              List<Map<String, Object>> missing,
                              boolean batch) implements FieldResolutionState {
        public CreatingViaSubflow {
            validated = copyItems(validated);
            missing = copyItems(missing);
        }

        public Map<String, Object> pendingItem() {
            return index < missing.size() ? JsonUtil.copyMap(missing.get(index)) : JsonUtil.copyMap(Map.of());
        }
    }

    record Done(Object value) implements FieldResolutionState {
    }

    private static List<Map<String, Object>> copyItems(List<Map<String, Object>> items) {
        List<Map<String, Object>> copy = new ArrayList<>();
        if (items != null) {
            for (Map<String, Object> item : items) {
                copy.add(JsonUtil.copyMap(item));
            }
        }
        return copy;
    }
}
