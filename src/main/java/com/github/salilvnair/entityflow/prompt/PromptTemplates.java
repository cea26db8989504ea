package com.github.salilvnair.entityflow.prompt;

public final class PromptTemplates {

    private PromptTemplates() {
    }

    public static final String RERANK_CANDIDATES = """
            The user referred to "{{identifier}}". Rank how likely each candidate below is the same entity.
            Candidates (id: value):
            [# th:each="c : ${candidates}"]- [(${c.id})]: [(${c.label})]
            [/]
            Reply with JSON only: {"ranking":[{"id":"<candidate id>","score":<0-100>}]}
            Only use the ids listed above.
            """;

    public static final String DUPLICATE_CHOICE = """
            The user was shown {{count}} existing records and asked to pick one by number or to create a new record.
            User reply: "{{text}}"
            Reply with JSON only: {"intent":"use|create|unclear","index":<1-based number or null>}
            """;

    public static final String CONFIRMATION = """
            The user was asked a yes/no question about creating new records.
            User reply: "{{text}}"
            Classify the reply as confirm, decline or modify (the user changes what should be created).
            Reply with JSON only: {"intent":"confirm|decline|modify|unclear"}
            """;

    public static final String EXTRACT_ITEMS = """
            Extract the list of items the user wants from the message below.
            Previous list: {{previous}}
            Message: "{{text}}"
            If the message replaces one item with another, return the whole updated list.
            Reply with JSON only: {"items":[{"name":"<item name>","quantity":<number>,"price":<number or null>}]}
            """;
}
