package com.github.salilvnair.entityflow.engine.context;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Marks whether a nested creation workflow currently owns the step cursor.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SubflowSlot.NoSubflow.class, name = "none"),
        @JsonSubTypes.Type(value = SubflowSlot.ActiveSubflow.class, name = "active")
})
public sealed interface SubflowSlot permits SubflowSlot.NoSubflow, SubflowSlot.ActiveSubflow {

    static SubflowSlot none() {
        return new NoSubflow();
    }

    record NoSubflow() implements SubflowSlot {
    }

    record ActiveSubflow(String workflowId, String parentFieldName, String entityName, String stepPrefix)
            implements SubflowSlot {

        public boolean owns(String step) {
            return step != null && stepPrefix != null && step.startsWith(stepPrefix);
        }

        public boolean servesField(String field) {
            return parentFieldName != null && parentFieldName.equals(field);
        }
    }
}
