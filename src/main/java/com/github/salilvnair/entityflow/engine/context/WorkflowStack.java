package com.github.salilvnair.entityflow.engine.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded stack of parent frames. The top of the stack is the last element of {@code frames}.
 */
@Getter
@Setter
@NoArgsConstructor
public class WorkflowStack {

    public static final int DEFAULT_MAX_DEPTH = 5;

    private List<StackFrame> frames = new ArrayList<>();
    private int maxDepth = DEFAULT_MAX_DEPTH;

    public WorkflowStack(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public void push(StackFrame frame) {
        if (frames.size() >= maxDepth) {
            throw new EntityFlowException(
                    EntityFlowErrorCode.WORKFLOW_STACK_OVERFLOW,
                    "Cannot start workflow " + frame.workflow() + " inside " + frames.size() + " nested workflows")
                    .withMetaData(Map.of("maxDepth", maxDepth));
        }
        frames.add(frame);
    }

    public Optional<StackFrame> pop() {
        if (frames.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(frames.remove(frames.size() - 1));
    }

    public Optional<StackFrame> peek() {
        if (frames.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(frames.get(frames.size() - 1));
    }

    public int depth() {
        return frames.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return frames.isEmpty();
    }

    WorkflowStack copy() {
        WorkflowStack copy = new WorkflowStack(maxDepth);
        for (StackFrame frame : frames) {
            copy.frames.add(new StackFrame(frame.workflow(), frame.step(), frame.activeSubflow(), frame.collectedData()));
        }
        return copy;
    }
}
