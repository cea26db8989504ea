package com.github.salilvnair.entityflow.engine.workflow;

import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Workflow definitions by id. Definitions are looked up lazily because host workflows
 * usually depend on the resolvers, which in turn depend on this registry.
 */
@Component
public class WorkflowRegistry {

    private final Supplier<List<WorkflowDefinition>> source;
    private volatile Map<String, WorkflowDefinition> workflows;

    @Autowired
    public WorkflowRegistry(ObjectProvider<WorkflowDefinition> workflows) {
        this.source = () -> workflows.orderedStream().toList();
    }

    public WorkflowRegistry(List<WorkflowDefinition> workflows) {
        List<WorkflowDefinition> fixed = List.copyOf(workflows);
        this.source = () -> fixed;
    }

    public boolean contains(String workflowId) {
        return workflowId != null && workflows().containsKey(workflowId);
    }

    public Optional<WorkflowDefinition> find(String workflowId) {
        return workflowId == null ? Optional.empty() : Optional.ofNullable(workflows().get(workflowId));
    }

    public WorkflowDefinition require(String workflowId) {
        return find(workflowId).orElseThrow(() -> new EntityFlowException(
                EntityFlowErrorCode.CONFIGURATION_ERROR, "Unknown workflow " + workflowId));
    }

    private Map<String, WorkflowDefinition> workflows() {
        Map<String, WorkflowDefinition> current = workflows;
        if (current == null) {
            current = source.get().stream()
                    .collect(Collectors.toMap(WorkflowDefinition::workflowId, Function.identity()));
            workflows = current;
        }
        return current;
    }
}
