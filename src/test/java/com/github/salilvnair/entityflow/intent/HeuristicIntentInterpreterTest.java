package com.github.salilvnair.entityflow.intent;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeuristicIntentInterpreterTest {

    private final HeuristicIntentInterpreter interpreter = new HeuristicIntentInterpreter();
    private final ItemExtractionHints hints = new ItemExtractionHints("name", "quantity", List.of());

    @Test
    void duplicateChoiceUnderstandsUseNumbersAndOrdinals() {
        assertEquals(IntentInterpretation.use(0, IntentInterpretation.SOURCE_HEURISTIC),
                interpreter.interpretDuplicateChoice("Yes", 3));
        assertEquals(IntentInterpretation.use(1, IntentInterpretation.SOURCE_HEURISTIC),
                interpreter.interpretDuplicateChoice("option 2", 3));
        assertEquals(IntentInterpretation.use(2, IntentInterpretation.SOURCE_HEURISTIC),
                interpreter.interpretDuplicateChoice("the third one", 3));
    }

    @Test
    void duplicateChoiceOutOfRangeIsUnclear() {
        assertTrue(interpreter.interpretDuplicateChoice("7", 3).isUnclear());
        assertTrue(interpreter.interpretDuplicateChoice("", 3).isUnclear());
    }

    @Test
    void duplicateChoiceRecognisesRequestsForANewRecord() {
        assertEquals(UserIntent.CREATE, interpreter.interpretDuplicateChoice("create a new one", 2).intent());
        assertEquals(UserIntent.CREATE, interpreter.interpretDuplicateChoice("none of these", 2).intent());
    }

    @Test
    void confirmationLabels() {
        assertEquals(UserIntent.CONFIRM, interpreter.interpretConfirmation("  Go ahead. ").intent());
        assertEquals(UserIntent.DECLINE, interpreter.interpretConfirmation("No thanks").intent());
        assertEquals(UserIntent.MODIFY, interpreter.interpretConfirmation("actually use the blue one instead").intent());
        assertEquals(UserIntent.CONFIRM, interpreter.interpretConfirmation("sure, create them").intent());
        assertEquals(UserIntent.UNCLEAR, interpreter.interpretConfirmation("what is this?").intent());
    }

    @Test
    void extractItemsParsesQuantitiesAndPrices() {
        List<Map<String, Object>> items = interpreter.extractItems("3 widgets at $4.50, gadget x 2 and a gizmo", hints);

        assertEquals(3, items.size());
        assertEquals("Widgets", items.get(0).get("name"));
        assertEquals(3, items.get(0).get("quantity"));
        assertEquals(new BigDecimal("4.50"), items.get(0).get("price"));
        assertEquals(Map.of("name", "Gadget", "quantity", 2), items.get(1));
        assertEquals(Map.of("name", "Gizmo", "quantity", 1), items.get(2));
    }

    @Test
    void replaceKeepsTheOldQuantityAndTheRestOfTheList() {
        ItemExtractionHints previous = new ItemExtractionHints("name", "quantity", List.of(
                Map.of("name", "Widget", "quantity", 4),
                Map.of("name", "Gizmo", "quantity", 2)));

        List<Map<String, Object>> items = interpreter.extractItems("replace gizmo with doohickey", previous);

        assertEquals(List.of(
                Map.of("name", "Widget", "quantity", 4),
                Map.of("name", "Doohickey", "quantity", 2)), items);
    }

    @Test
    void insteadOfWithUnknownItemReturnsOnlyTheReplacement() {
        ItemExtractionHints previous = new ItemExtractionHints("name", "quantity",
                List.of(Map.of("name", "Widget", "quantity", 4)));

        List<Map<String, Object>> items = interpreter.extractItems("5 sprockets instead of cogs", previous);

        assertEquals(List.of(Map.of("name", "Sprockets", "quantity", 5)), items);
    }

    @Test
    void trailingInsteadIsNotPartOfTheName() {
        List<Map<String, Object>> items = interpreter.extractItems("actually, 3 laptops instead", hints);

        assertEquals(List.of(Map.of("name", "Laptops", "quantity", 3)), items);
    }
}
