package com.github.salilvnair.entityflow.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one resolution attempt. {@link NeedsUserInput} is the only variant that
 * asks the host for another conversational turn.
 */
public sealed interface ActionResult permits ActionResult.Success, ActionResult.Failure, ActionResult.NeedsUserInput {

    default boolean isTerminal() {
        return !(this instanceof NeedsUserInput);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean needsUserInput() {
        return this instanceof NeedsUserInput;
    }

    /** User-facing text of the result, or the error for failures. */
    String text();

    static Success success(String message) {
        return new Success(message, Map.of());
    }

    static Success success(String message, Map<String, Object> data) {
        return new Success(message, data);
    }

    static Failure failure(String error) {
        return new Failure(error);
    }

    static NeedsUserInput needsInput(String message, Map<String, Object> metadata) {
        return new NeedsUserInput(message, metadata);
    }

    record Success(String message, Map<String, Object> data) implements ActionResult {
        public Success {
            data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }

        @Override
        public String text() {
            return message;
        }
    }

    record Failure(String error) implements ActionResult {
        @Override
        public String text() {
            return error;
        }
    }

    record NeedsUserInput(String message, Map<String, Object> metadata) implements ActionResult {
        public NeedsUserInput {
            metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }

        @Override
        public String text() {
            return message;
        }
    }
}
