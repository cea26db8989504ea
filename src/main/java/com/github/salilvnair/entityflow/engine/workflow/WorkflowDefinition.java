package com.github.salilvnair.entityflow.engine.workflow;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A steppable workflow. When run as a subflow its step names carry the prefix handed to
 * {@link #steps(String)}, which keeps them apart from the parent's steps.
 */
public interface WorkflowDefinition {

    String workflowId();

    List<WorkflowStep> steps(String stepPrefix);

    /** Fields this workflow collects; cleared before each item of a batch subflow. */
    default Set<String> entityFields() {
        return Set.of();
    }

    default String identifierField() {
        return "name";
    }

    default String firstStep(String stepPrefix) {
        List<WorkflowStep> steps = steps(stepPrefix);
        return steps.isEmpty() ? null : steps.get(0).getName();
    }

    default Optional<WorkflowStep> step(String stepPrefix, String stepName) {
        return steps(stepPrefix).stream().filter(s -> s.getName().equals(stepName)).findFirst();
    }

    static String stepName(String stepPrefix, String name) {
        return stepPrefix == null || stepPrefix.isBlank() ? name : stepPrefix + "_" + name;
    }
}
