package com.github.salilvnair.entityflow.intent;

import java.util.List;
import java.util.Map;

/**
 * Turns a free-text user reply into one of the fixed {@link UserIntent} labels.
 */
public interface IntentInterpreter {

    /** USE (with index), CREATE or UNCLEAR. */
    IntentInterpretation interpretDuplicateChoice(String text, int candidateCount);

    /** CONFIRM, DECLINE, MODIFY or UNCLEAR. */
    IntentInterpretation interpretConfirmation(String text);

    /** A complete replacement item list; empty when nothing usable was found. */
    List<Map<String, Object>> extractItems(String text, ItemExtractionHints hints);
}
