package com.github.salilvnair.entityflow.intent;

import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import com.github.salilvnair.entityflow.llm.core.TextCompleter;
import com.github.salilvnair.entityflow.template.ThymeleafTemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AiIntentInterpreterTest {

    @Mock
    private TextCompleter completer;

    private AiIntentInterpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new AiIntentInterpreter(completer, new ThymeleafTemplateRenderer(), new EntityFlowProperties.Completer());
    }

    @Test
    void duplicateChoiceConvertsOneBasedIndex() {
        when(completer.complete(anyString(), anyInt(), anyDouble())).thenReturn("{\"intent\":\"use\",\"index\":2}");

        IntentInterpretation result = interpreter.interpretDuplicateChoice("the second", 3);

        assertEquals(IntentInterpretation.use(1, IntentInterpretation.SOURCE_AI), result);
        verify(completer).complete(argThat(prompt -> prompt.contains("shown 3 existing records")), anyInt(), anyDouble());
    }

    @Test
    void duplicateChoiceIndexOutOfRangeIsRejected() {
        when(completer.complete(anyString(), anyInt(), anyDouble())).thenReturn("{\"intent\":\"use\",\"index\":9}");

        EntityFlowException e = assertThrows(EntityFlowException.class,
                () -> interpreter.interpretDuplicateChoice("nine", 3));

        assertTrue(e.is(EntityFlowErrorCode.PROVIDER_INVALID_RESPONSE));
    }

    @Test
    void confirmationLabelOutsideTheAllowedSetIsRejected() {
        when(completer.complete(anyString(), anyInt(), anyDouble())).thenReturn("{\"intent\":\"use\"}");

        assertThrows(EntityFlowException.class, () -> interpreter.interpretConfirmation("yes"));
    }

    @Test
    void confirmationAcceptsFencedJson() {
        when(completer.complete(anyString(), anyInt(), anyDouble()))
                .thenReturn("```json\n{\"intent\":\"modify\"}\n```");

        assertEquals(UserIntent.MODIFY, interpreter.interpretConfirmation("swap the last one").intent());
    }

    @Test
    void extractItemsNormalisesNamesAndDefaults() {
        when(completer.complete(anyString(), anyInt(), anyDouble())).thenReturn(
                "{\"items\":[{\"name\":\"blue widget\",\"quantity\":3,\"price\":2.5},{\"name\":\"cog\"},{\"quantity\":2}]}");

        List<Map<String, Object>> items = interpreter.extractItems("3 blue widgets and a cog",
                new ItemExtractionHints("name", "quantity", List.of()));

        assertEquals(2, items.size());
        assertEquals("Blue Widget", items.get(0).get("name"));
        assertEquals(new BigDecimal("2.5"), items.get(0).get("price"));
        assertEquals(Map.of("name", "Cog", "quantity", 1), items.get(1));
    }

    @Test
    void nonJsonReplyIsRejected() {
        when(completer.complete(anyString(), anyInt(), anyDouble())).thenReturn("I think they said yes");

        assertThrows(EntityFlowException.class, () -> interpreter.interpretConfirmation("yes"));
    }
}
