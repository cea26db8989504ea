package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;
import com.github.salilvnair.entityflow.util.TextUtil;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Presentation names for fields and entity types. Lookups are cached for the lifetime of this bean.
 */
@Component
public class FriendlyNameResolver {

    private final Map<String, String> pluralRules;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public FriendlyNameResolver(EntityFlowProperties properties) {
        this.pluralRules = new LinkedHashMap<>();
        properties.getFriendlyNames().getPluralRules()
                .forEach((k, v) -> pluralRules.put(k.toLowerCase(Locale.ROOT), v));
    }

    /** Plural, lower-case name used in prompts about many items, e.g. {@code line items}. */
    public String friendlyName(String field, ResolutionConfig config) {
        if (config != null && config.getFriendlyName() != null && !config.getFriendlyName().isBlank()) {
            return config.getFriendlyName();
        }
        return cache.computeIfAbsent(field, this::pluralPhrase);
    }

    /** Singular, capitalised entity type name, e.g. {@code Customer}. */
    public String entityName(ResolutionConfig config) {
        if (config.getDisplayName() != null && !config.getDisplayName().isBlank()) {
            return config.getDisplayName();
        }
        String model = config.getModel() == null ? "entity" : config.getModel();
        String base = model.substring(Math.max(model.lastIndexOf('.'), model.lastIndexOf('\\')) + 1);
        return TextUtil.capitalize(base.replace('_', ' ').trim());
    }

    public String pluralize(String word) {
        if (word == null || word.isBlank()) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        String custom = pluralRules.get(lower);
        if (custom != null) {
            return custom;
        }
        if (lower.matches(".*[^aeiou]y$")) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (lower.matches(".*(ss|sh|ch|x|z)$")) {
            return word + "es";
        }
        if (lower.endsWith("s")) {
            return word;
        }
        if (lower.endsWith("fe")) {
            return word.substring(0, word.length() - 2) + "ves";
        }
        if (lower.endsWith("f")) {
            return word.substring(0, word.length() - 1) + "ves";
        }
        return word + "s";
    }

    private String pluralPhrase(String field) {
        String phrase = field.replaceAll("_ids?$", "").replace('_', ' ').trim().toLowerCase(Locale.ROOT);
        int lastSpace = phrase.lastIndexOf(' ');
        if (lastSpace < 0) {
            return pluralize(phrase);
        }
        String custom = pluralRules.get(phrase);
        if (custom != null) {
            return custom;
        }
        return phrase.substring(0, lastSpace + 1) + pluralize(phrase.substring(lastSpace + 1));
    }
}
