package com.github.salilvnair.entityflow.intent;

/**
 * @param index zero-based candidate index, only set for {@link UserIntent#USE}
 * @param source which interpreter produced the result
 */
public record IntentInterpretation(UserIntent intent, Integer index, String source) {

    public static final String SOURCE_HEURISTIC = "HEURISTIC";
    public static final String SOURCE_AI = "AI";

    public static IntentInterpretation of(UserIntent intent, String source) {
        return new IntentInterpretation(intent, null, source);
    }

    public static IntentInterpretation use(int index, String source) {
        return new IntentInterpretation(UserIntent.USE, index, source);
    }

    public static IntentInterpretation unclear(String source) {
        return new IntentInterpretation(UserIntent.UNCLEAR, null, source);
    }

    public boolean isUnclear() {
        return intent == null || intent == UserIntent.UNCLEAR;
    }
}
