package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;
import com.github.salilvnair.entityflow.util.TextUtil;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reduces an identifier to the single value used for searching. Structured identifiers are
 * remembered on the context so later steps (and subflows) can reuse their other fields.
 */
@Component
public class IdentifierExtractor {

    public String searchValue(String field, ResolutionConfig config, Object identifier, WorkflowContext ctx) {
        if (identifier == null) {
            return null;
        }
        if (identifier instanceof Map<?, ?> raw) {
            Map<String, Object> payload = new LinkedHashMap<>();
            raw.forEach((k, v) -> payload.put(String.valueOf(k), v));
            ctx.mergeExtractedData(field, payload);
            for (String searchField : config.effectiveSearchFields()) {
                String value = scalar(payload.get(searchField));
                if (value != null) {
                    return value;
                }
            }
            for (Object value : payload.values()) {
                String text = scalar(value);
                if (text != null) {
                    return text;
                }
            }
            return null;
        }
        return TextUtil.asText(identifier);
    }

    private String scalar(Object value) {
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
            return null;
        }
        return TextUtil.asText(value);
    }
}
