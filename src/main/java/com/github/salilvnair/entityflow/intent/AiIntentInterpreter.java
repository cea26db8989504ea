package com.github.salilvnair.entityflow.intent;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import com.github.salilvnair.entityflow.llm.core.TextCompleter;
import com.github.salilvnair.entityflow.prompt.PromptTemplates;
import com.github.salilvnair.entityflow.template.ThymeleafTemplateRenderer;
import com.github.salilvnair.entityflow.util.JsonUtil;
import com.github.salilvnair.entityflow.util.TextUtil;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Provider-backed interpretation. Every label is checked against the allowed set for the
 * question asked; anything else is rejected as an invalid response.
 */
@RequiredArgsConstructor
public class AiIntentInterpreter implements IntentInterpreter {

    private static final String SOURCE = IntentInterpretation.SOURCE_AI;
    private static final Set<UserIntent> DUPLICATE_LABELS = EnumSet.of(UserIntent.USE, UserIntent.CREATE, UserIntent.UNCLEAR);
    private static final Set<UserIntent> CONFIRMATION_LABELS =
            EnumSet.of(UserIntent.CONFIRM, UserIntent.DECLINE, UserIntent.MODIFY, UserIntent.UNCLEAR);

    private final TextCompleter completer;
    private final ThymeleafTemplateRenderer renderer;
    private final EntityFlowProperties.Completer settings;

    @Override
    public IntentInterpretation interpretDuplicateChoice(String text, int candidateCount) {
        JsonNode reply = ask(PromptTemplates.DUPLICATE_CHOICE, Map.of("text", safe(text), "count", candidateCount));
        UserIntent intent = label(reply, DUPLICATE_LABELS);
        if (intent != UserIntent.USE) {
            return IntentInterpretation.of(intent, SOURCE);
        }
        JsonNode index = reply.path("index");
        if (!index.canConvertToInt() || index.asInt() < 1 || index.asInt() > candidateCount) {
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_INVALID_RESPONSE,
                    "Duplicate choice index out of range: " + index);
        }
        return IntentInterpretation.use(index.asInt() - 1, SOURCE);
    }

    @Override
    public IntentInterpretation interpretConfirmation(String text) {
        JsonNode reply = ask(PromptTemplates.CONFIRMATION, Map.of("text", safe(text)));
        return IntentInterpretation.of(label(reply, CONFIRMATION_LABELS), SOURCE);
    }

    @Override
    public List<Map<String, Object>> extractItems(String text, ItemExtractionHints hints) {
        List<String> previous = new ArrayList<>();
        for (Map<String, Object> item : hints.previousItems()) {
            previous.add(item.get(hints.quantityKey()) + " x " + item.get(hints.identifierKey()));
        }
        JsonNode reply = ask(PromptTemplates.EXTRACT_ITEMS, Map.of("text", safe(text), "previous", String.join(", ", previous)));
        JsonNode items = reply.path("items");
        if (!items.isArray()) {
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_INVALID_RESPONSE, "Item extraction reply had no items array");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (JsonNode node : items) {
            String name = TextUtil.asText(node.path("name").asText(null));
            if (name == null) {
                continue;
            }
            Map<String, Object> item = new LinkedHashMap<>();
            item.put(hints.identifierKey(), TextUtil.normalizeName(name));
            item.put(hints.quantityKey(), Math.max(1, node.path("quantity").asInt(1)));
            if (node.path("price").isNumber()) {
                item.put("price", new BigDecimal(node.path("price").asText()));
            }
            result.add(item);
        }
        return result;
    }

    private JsonNode ask(String template, Map<String, Object> variables) {
        String prompt = renderer.render(template, variables);
        JsonNode reply = JsonUtil.parseOrNull(completer.complete(prompt, settings.getMaxTokens(), settings.getTemperature()));
        if (reply == null || !reply.isObject()) {
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_INVALID_RESPONSE, "Completion reply was not a JSON object");
        }
        return reply;
    }

    private UserIntent label(JsonNode reply, Set<UserIntent> allowed) {
        String raw = reply.path("intent").asText(null);
        UserIntent intent = UserIntent.from(raw, null);
        if (intent == null || !allowed.contains(intent)) {
            throw new EntityFlowException(EntityFlowErrorCode.PROVIDER_INVALID_RESPONSE, "Unknown intent label: " + raw);
        }
        return intent;
    }

    private String safe(String text) {
        return text == null ? "" : text.replace("\"", "'");
    }
}
