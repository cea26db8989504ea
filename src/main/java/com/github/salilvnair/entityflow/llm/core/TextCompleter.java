package com.github.salilvnair.entityflow.llm.core;

/**
 * Provider-agnostic, synchronous text completion. Implemented by the host application.
 */
public interface TextCompleter {

    String complete(String prompt, int maxTokens, double temperature);
}
