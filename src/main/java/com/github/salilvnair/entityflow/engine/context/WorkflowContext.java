package com.github.salilvnair.entityflow.engine.context;

import com.github.salilvnair.entityflow.util.JsonUtil;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-session state carried across turns. Everything a resolution needs on the next turn
 * must live here; nothing is kept on the call stack between turns.
 */
@Getter
@Setter
@NoArgsConstructor
public class WorkflowContext {

    private String sessionId;
    private Map<String, Object> state = new LinkedHashMap<>();
    private Map<String, Object> collectedData = new LinkedHashMap<>();
    private List<ConversationTurn> conversationHistory = new ArrayList<>();
    private String currentStep;
    private String currentWorkflow;
    private WorkflowStack workflowStack = new WorkflowStack();
    private SubflowSlot activeSubflow = SubflowSlot.none();
    private Map<String, FieldResolutionState> fieldStates = new LinkedHashMap<>();
    private Map<String, Map<String, Object>> extractedData = new LinkedHashMap<>();

    public static WorkflowContext create(String sessionId) {
        WorkflowContext ctx = new WorkflowContext();
        ctx.setSessionId(sessionId);
        return ctx;
    }

    public static WorkflowContext create(String sessionId, int maxStackDepth) {
        WorkflowContext ctx = create(sessionId);
        ctx.setWorkflowStack(new WorkflowStack(maxStackDepth));
        return ctx;
    }

    // ---------------------------------------------------------------- state bag

    public Object get(String key) {
        return state.get(key);
    }

    public Object get(String key, Object defaultValue) {
        Object value = state.get(key);
        return value == null ? defaultValue : value;
    }

    public void set(String key, Object value) {
        state.put(key, value);
    }

    public Object forget(String key) {
        return state.remove(key);
    }

    public boolean has(String key) {
        return state.get(key) != null;
    }

    // ---------------------------------------------------------------- conversation

    public void addUserMessage(String content) {
        conversationHistory.add(ConversationTurn.user(content));
    }

    public void addAssistantMessage(String content) {
        conversationHistory.add(ConversationTurn.assistant(content));
    }

    public String lastUserMessage() {
        for (int i = conversationHistory.size() - 1; i >= 0; i--) {
            ConversationTurn turn = conversationHistory.get(i);
            if (turn.fromUser()) {
                return turn.content() == null ? "" : turn.content();
            }
        }
        return "";
    }

    // ---------------------------------------------------------------- field states

    public FieldResolutionState fieldState(String field) {
        FieldResolutionState fieldState = fieldStates.get(field);
        return fieldState == null ? FieldResolutionState.idle() : fieldState;
    }

    public void updateFieldState(String field, FieldResolutionState fieldState) {
        if (fieldState == null || fieldState instanceof FieldResolutionState.Idle) {
            fieldStates.remove(field);
            return;
        }
        fieldStates.put(field, fieldState);
    }

    public void clearFieldState(String field) {
        fieldStates.remove(field);
    }

    public Map<String, Object> extractedData(String field) {
        Map<String, Object> data = extractedData.get(field);
        return data == null ? Map.of() : data;
    }

    public void mergeExtractedData(String field, Map<String, ?> payload) {
        Map<String, Object> current = extractedData.computeIfAbsent(field, k -> new LinkedHashMap<>());
        JsonUtil.merge(current, payload);
    }

    // ---------------------------------------------------------------- subflow

    public Optional<SubflowSlot.ActiveSubflow> activeSubflowSlot() {
        if (activeSubflow instanceof SubflowSlot.ActiveSubflow active) {
            return Optional.of(active);
        }
        return Optional.empty();
    }

    public boolean inSubflow() {
        return activeSubflow instanceof SubflowSlot.ActiveSubflow;
    }

    /** True while the active subflow still owns {@link #currentStep}. */
    public boolean subflowOwnsCurrentStep() {
        return activeSubflowSlot().map(a -> a.owns(currentStep)).orElse(false);
    }

    // ---------------------------------------------------------------- snapshots

    public WorkflowContext copy() {
        WorkflowContext copy = new WorkflowContext();
        copy.sessionId = sessionId;
        copy.state = JsonUtil.copyMap(state);
        copy.collectedData = JsonUtil.copyMap(collectedData);
        copy.conversationHistory = new ArrayList<>(conversationHistory);
        copy.currentStep = currentStep;
        copy.currentWorkflow = currentWorkflow;
        copy.workflowStack = workflowStack.copy();
        copy.activeSubflow = activeSubflow;
        copy.fieldStates = new LinkedHashMap<>(fieldStates);
        Map<String, Map<String, Object>> extracted = new LinkedHashMap<>();
        extractedData.forEach((k, v) -> extracted.put(k, JsonUtil.copyMap(v)));
        copy.extractedData = extracted;
        return copy;
    }

    /** Replace every slot of this context with a copy of {@code snapshot}. */
    public void restoreFrom(WorkflowContext snapshot) {
        WorkflowContext source = snapshot.copy();
        this.sessionId = source.sessionId;
        this.state = source.state;
        this.collectedData = source.collectedData;
        this.conversationHistory = source.conversationHistory;
        this.currentStep = source.currentStep;
        this.currentWorkflow = source.currentWorkflow;
        this.workflowStack = source.workflowStack;
        this.activeSubflow = source.activeSubflow;
        this.fieldStates = source.fieldStates;
        this.extractedData = source.extractedData;
    }
}
