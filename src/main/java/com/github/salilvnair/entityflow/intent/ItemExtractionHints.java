package com.github.salilvnair.entityflow.intent;

import java.util.List;
import java.util.Map;

/**
 * What an item-list extraction needs to know about the batch it is rewriting.
 */
public record ItemExtractionHints(String identifierKey, String quantityKey, List<Map<String, Object>> previousItems) {

    public ItemExtractionHints {
        identifierKey = identifierKey == null ? "name" : identifierKey;
        quantityKey = quantityKey == null ? "quantity" : quantityKey;
        previousItems = previousItems == null ? List.of() : List.copyOf(previousItems);
    }
}
