package com.github.salilvnair.entityflow.intent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Tries the primary interpreter first and uses the fallback whenever the primary fails,
 * answers UNCLEAR or extracts nothing.
 */
@Slf4j
@RequiredArgsConstructor
public class FallbackIntentInterpreter implements IntentInterpreter {

    private final IntentInterpreter primary;
    private final IntentInterpreter fallback;

    @Override
    public IntentInterpretation interpretDuplicateChoice(String text, int candidateCount) {
        return interpret("duplicate choice",
                () -> primary.interpretDuplicateChoice(text, candidateCount),
                () -> fallback.interpretDuplicateChoice(text, candidateCount));
    }

    @Override
    public IntentInterpretation interpretConfirmation(String text) {
        return interpret("confirmation",
                () -> primary.interpretConfirmation(text),
                () -> fallback.interpretConfirmation(text));
    }

    @Override
    public List<Map<String, Object>> extractItems(String text, ItemExtractionHints hints) {
        try {
            List<Map<String, Object>> items = primary.extractItems(text, hints);
            if (items != null && !items.isEmpty()) {
                return items;
            }
        } catch (RuntimeException e) {
            log.warn("Primary item extraction failed, falling back: {}", e.getMessage());
        }
        return fallback.extractItems(text, hints);
    }

    private IntentInterpretation interpret(String kind,
                                           Supplier<IntentInterpretation> first,
                                           Supplier<IntentInterpretation> second) {
        try {
            IntentInterpretation result = first.get();
            if (result != null && !result.isUnclear()) {
                return result;
            }
        } catch (RuntimeException e) {
            log.warn("Primary {} interpretation failed, falling back: {}", kind, e.getMessage());
        }
        return second.get();
    }
}
