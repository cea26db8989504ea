package com.github.salilvnair.entityflow.engine.context;

import com.github.salilvnair.entityflow.util.JsonUtil;

import java.util.Map;

/**
 * Parent cursor saved when a subflow starts. {@code collectedData} is a private snapshot
 * that is restored verbatim when the subflow completes.
 */
public record StackFrame(String workflow, String step, SubflowSlot activeSubflow, Map<String, Object> collectedData) {

    public StackFrame {
        activeSubflow = activeSubflow == null ? SubflowSlot.none() : activeSubflow;
        collectedData = JsonUtil.copyMap(collectedData);
    }

    public Map<String, Object> restoredCollectedData() {
        return JsonUtil.copyMap(collectedData);
    }
}
