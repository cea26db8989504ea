package com.github.salilvnair.entityflow.engine.context;

public record ConversationTurn(String role, String content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public static ConversationTurn user(String content) {
        return new ConversationTurn(USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(ASSISTANT, content);
    }

    public boolean fromUser() {
        return USER.equals(role);
    }
}
