package com.github.salilvnair.entityflow.intent;

import com.github.salilvnair.entityflow.util.TextUtil;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and pattern based interpretation. Deterministic, needs no provider, and is the
 * behaviour every other interpreter falls back to.
 */
public class HeuristicIntentInterpreter implements IntentInterpreter {

    private static final String SOURCE = IntentInterpretation.SOURCE_HEURISTIC;

    private static final Pattern USE_FIRST = Pattern.compile("^(use|yes|y|ok|sure|yeah)$");
    private static final Pattern CREATE_NEW = Pattern.compile("(new|create|different|another)");
    private static final Pattern NUMBER = Pattern.compile("\\b(\\d+)\\b");
    private static final Pattern NONE = Pattern.compile("\\b(none|neither|no|nope)\\b");
    private static final Map<String, Integer> ORDINALS = ordinals();

    private static final Pattern AFFIRM = Pattern.compile(
            "^(yes|y|yep|yeah|ok|okay|sure|go ahead|do that|please do|confirm|approved?|create( it| them)?|yes please)$");
    private static final Pattern NEGATE = Pattern.compile(
            "^(no|n|nope|nah|cancel|stop|don't|do not|never mind|no thanks)$");
    private static final Pattern MODIFY = Pattern.compile(
            "\\b(replace|change|instead|swap|modify|update|edit|remove|actually|rather)\\b");
    private static final Pattern AFFIRM_WORD = Pattern.compile(
            "\\b(yes|yeah|yep|sure|ok|okay|confirm|go ahead|create)\\b");
    private static final Pattern NEGATE_WORD = Pattern.compile(
            "\\b(no|nope|cancel|stop|don't|do not|never mind)\\b");

    private static final Pattern REPLACE = Pattern.compile(
            "(?:replace|swap|change)\\s+(.+?)\\s+(?:with|to|for|by)\\s+(.+)");
    private static final Pattern INSTEAD_OF = Pattern.compile("(.+?)\\s+instead\\s+of\\s+(.+)");
    private static final Pattern FILLER = Pattern.compile(
            "^(?:actually|instead|no|ok|okay|please|i want|i need|make it|let's do|lets do|use|add|just)[,:\\s]+");
    private static final Pattern TRAILING_FILLER = Pattern.compile("(?i)[,\\s]+(?:instead|please|then)[.!?]*$");
    private static final Pattern SPLIT = Pattern.compile("\\s*(?:,|;|\\band\\b|&)\\s*");
    private static final Pattern PRICE = Pattern.compile(
            "(?:\\b(?:at|for)\\s*|@\\s*)?\\$\\s*(\\d+(?:\\.\\d{1,2})?)(?:\\s*each)?|(?:\\b(?:at|for)\\s+|@\\s*)(\\d+(?:\\.\\d{1,2})?)(?:\\s*each)?");
    private static final Pattern LEADING_QTY = Pattern.compile(
            "^(\\d+)\\s*(?:x|pcs|pieces?|items?|units?)?\\s+(?:of\\s+)?(.+)$");
    private static final Pattern TRAILING_QTY = Pattern.compile("^(.+?)\\s*(?:x|\\*)\\s*(\\d+)$");

    @Override
    public IntentInterpretation interpretDuplicateChoice(String text, int candidateCount) {
        String reply = normalize(text);
        if (reply.isEmpty()) {
            return IntentInterpretation.unclear(SOURCE);
        }
        if (USE_FIRST.matcher(reply).matches() && candidateCount > 0) {
            return IntentInterpretation.use(0, SOURCE);
        }
        if (CREATE_NEW.matcher(reply).find()) {
            return IntentInterpretation.of(UserIntent.CREATE, SOURCE);
        }
        Matcher number = NUMBER.matcher(reply);
        if (number.find()) {
            int choice = Integer.parseInt(number.group(1));
            if (choice >= 1 && choice <= candidateCount) {
                return IntentInterpretation.use(choice - 1, SOURCE);
            }
        }
        for (Map.Entry<String, Integer> ordinal : ORDINALS.entrySet()) {
            if (Pattern.compile("\\b" + ordinal.getKey() + "\\b").matcher(reply).find()
                    && ordinal.getValue() < candidateCount) {
                return IntentInterpretation.use(ordinal.getValue(), SOURCE);
            }
        }
        if (NONE.matcher(reply).find()) {
            return IntentInterpretation.of(UserIntent.CREATE, SOURCE);
        }
        return IntentInterpretation.unclear(SOURCE);
    }

    @Override
    public IntentInterpretation interpretConfirmation(String text) {
        String reply = normalize(text);
        if (reply.isEmpty()) {
            return IntentInterpretation.unclear(SOURCE);
        }
        if (AFFIRM.matcher(reply).matches()) {
            return IntentInterpretation.of(UserIntent.CONFIRM, SOURCE);
        }
        if (NEGATE.matcher(reply).matches()) {
            return IntentInterpretation.of(UserIntent.DECLINE, SOURCE);
        }
        if (MODIFY.matcher(reply).find()) {
            return IntentInterpretation.of(UserIntent.MODIFY, SOURCE);
        }
        if (AFFIRM_WORD.matcher(reply).find()) {
            return IntentInterpretation.of(UserIntent.CONFIRM, SOURCE);
        }
        if (NEGATE_WORD.matcher(reply).find()) {
            return IntentInterpretation.of(UserIntent.DECLINE, SOURCE);
        }
        return IntentInterpretation.unclear(SOURCE);
    }

    @Override
    public List<Map<String, Object>> extractItems(String text, ItemExtractionHints hints) {
        String reply = normalize(text);
        if (reply.isEmpty()) {
            return List.of();
        }
        Matcher replace = REPLACE.matcher(reply);
        if (replace.find()) {
            return replaceItem(replace.group(1), replace.group(2), hints);
        }
        Matcher insteadOf = INSTEAD_OF.matcher(reply);
        if (insteadOf.matches()) {
            return replaceItem(insteadOf.group(2), insteadOf.group(1), hints);
        }
        List<Map<String, Object>> items = new ArrayList<>();
        for (String segment : SPLIT.split(stripFiller(reply))) {
            Map<String, Object> item = parseSegment(segment, hints);
            if (item != null) {
                items.add(item);
            }
        }
        return items;
    }

    private List<Map<String, Object>> replaceItem(String oldName, String newText, ItemExtractionHints hints) {
        Map<String, Object> replacement = parseSegment(newText, hints);
        if (replacement == null) {
            return List.of();
        }
        String target = cleanName(oldName).toLowerCase(Locale.ROOT);
        List<Map<String, Object>> items = new ArrayList<>();
        boolean replaced = false;
        for (Map<String, Object> previous : hints.previousItems()) {
            Object name = previous.get(hints.identifierKey());
            String current = name == null ? "" : String.valueOf(name).toLowerCase(Locale.ROOT);
            if (!replaced && !current.isEmpty() && (current.equals(target) || current.contains(target))) {
                Map<String, Object> swapped = new LinkedHashMap<>(replacement);
                if (!explicitQuantity(newText)) {
                    Object quantity = previous.get(hints.quantityKey());
                    swapped.put(hints.quantityKey(), quantity == null ? 1 : quantity);
                }
                items.add(swapped);
                replaced = true;
            } else {
                items.add(carryOver(previous, hints));
            }
        }
        return replaced ? items : List.of(replacement);
    }

    private Map<String, Object> carryOver(Map<String, Object> previous, ItemExtractionHints hints) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put(hints.identifierKey(), previous.get(hints.identifierKey()));
        item.put(hints.quantityKey(), previous.getOrDefault(hints.quantityKey(), 1));
        if (previous.get("price") != null) {
            item.put("price", previous.get("price"));
        }
        return item;
    }

    private Map<String, Object> parseSegment(String segment, ItemExtractionHints hints) {
        String working = segment == null ? "" : segment.trim();
        BigDecimal price = null;
        Matcher priceMatcher = PRICE.matcher(working);
        if (priceMatcher.find()) {
            String amount = priceMatcher.group(1) != null ? priceMatcher.group(1) : priceMatcher.group(2);
            price = new BigDecimal(amount);
            working = (working.substring(0, priceMatcher.start()) + working.substring(priceMatcher.end())).trim();
        }
        working = TRAILING_FILLER.matcher(working).replaceFirst("");
        int quantity = 1;
        Matcher leading = LEADING_QTY.matcher(working);
        Matcher trailing = TRAILING_QTY.matcher(working);
        if (leading.matches()) {
            quantity = Integer.parseInt(leading.group(1));
            working = leading.group(2);
        } else if (trailing.matches()) {
            quantity = Integer.parseInt(trailing.group(2));
            working = trailing.group(1);
        }
        String name = cleanName(working);
        if (name.isEmpty()) {
            return null;
        }
        Map<String, Object> item = new LinkedHashMap<>();
        item.put(hints.identifierKey(), TextUtil.normalizeName(name));
        item.put(hints.quantityKey(), Math.max(1, quantity));
        if (price != null) {
            item.put("price", price);
        }
        return item;
    }

    private boolean explicitQuantity(String text) {
        String trimmed = text.trim();
        return LEADING_QTY.matcher(trimmed).matches() || TRAILING_QTY.matcher(trimmed).matches();
    }

    private String stripFiller(String text) {
        String current = text;
        String previous;
        do {
            previous = current;
            current = FILLER.matcher(current).replaceFirst("");
        } while (!current.equals(previous));
        return current;
    }

    private String cleanName(String raw) {
        if (raw == null) {
            return "";
        }
        String name = TRAILING_FILLER.matcher(raw.trim()).replaceFirst("");
        return name.replaceAll("^(the|a|an)\\s+", "").replaceAll("[.!?]+$", "").trim();
    }

    private String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().toLowerCase(Locale.ROOT).replaceAll("[.!?]+$", "").replaceAll("\\s+", " ");
    }

    private static Map<String, Integer> ordinals() {
        Map<String, Integer> ordinals = new LinkedHashMap<>();
        String[] words = {"first", "second", "third", "fourth", "fifth"};
        String[] abbreviations = {"1st", "2nd", "3rd", "4th", "5th"};
        for (int i = 0; i < words.length; i++) {
            ordinals.put(words[i], i);
            ordinals.put(abbreviations[i], i);
        }
        return ordinals;
    }
}
