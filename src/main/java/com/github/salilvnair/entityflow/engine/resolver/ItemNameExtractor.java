package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.util.TextUtil;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Picks a human readable name out of a loosely structured item.
 */
@Component
public class ItemNameExtractor {

    private static final List<String> NAME_KEYS = List.of("name", "title", "label", "identifier");
    private static final Set<String> NON_NAME_KEYS = Set.of(
            "id", "created_at", "updated_at", "workspace", "workspace_id", "created_by", "quantity", "price");
    private static final int DESCRIPTION_LIMIT = 50;

    public String extract(Map<String, Object> item, String identifierKey, String entityType) {
        if (item == null || item.isEmpty()) {
            return unknown(entityType);
        }
        String name = firstText(item, identifierKey);
        for (int i = 0; name == null && i < NAME_KEYS.size(); i++) {
            name = firstText(item, NAME_KEYS.get(i));
        }
        if (name == null && entityType != null) {
            name = firstText(item, entityType.toLowerCase(Locale.ROOT));
        }
        if (name == null) {
            String description = firstText(item, "description");
            if (description != null) {
                name = description.length() > DESCRIPTION_LIMIT ? description.substring(0, DESCRIPTION_LIMIT) : description;
            }
        }
        if (name == null) {
            for (Map.Entry<String, Object> entry : item.entrySet()) {
                if (entry.getValue() instanceof String text && !text.isBlank() && !NON_NAME_KEYS.contains(entry.getKey())) {
                    name = text;
                    break;
                }
            }
        }
        return name == null ? unknown(entityType) : TextUtil.normalizeName(name);
    }

    private String firstText(Map<String, Object> item, String key) {
        if (key == null) {
            return null;
        }
        Object value = item.get(key);
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            return null;
        }
        return TextUtil.asText(value);
    }

    private String unknown(String entityType) {
        return "Unknown " + (entityType == null ? "item" : entityType);
    }
}
