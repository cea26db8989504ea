package com.github.salilvnair.entityflow.engine.subflow;

import com.github.salilvnair.entityflow.engine.context.SubflowSlot;

import java.util.Collections;
import java.util.Map;

/**
 * What a finished subflow hands back to its parent.
 *
 * @param entityId id of the created entity, or null when the subflow did not report one
 * @param subflowData the subflow's collected data at completion
 */
public record SubflowOutcome(Object entityId, Map<String, Object> subflowData, SubflowSlot.ActiveSubflow subflow) {

    public SubflowOutcome {
        subflowData = subflowData == null ? Map.of() : Collections.unmodifiableMap(subflowData);
    }

    public boolean created() {
        return entityId != null;
    }
}
