package com.github.salilvnair.entityflow.config;

import com.github.salilvnair.entityflow.intent.IntentInterpreterMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "entityflow")
@Getter
@Setter
public class EntityFlowProperties {

    /** memory or jpa. */
    private String sessionStore = "memory";

    private Ranking ranking = new Ranking();
    private Intent intent = new Intent();
    private Completer completer = new Completer();
    private Workflow workflow = new Workflow();
    private Creation creation = new Creation();
    private FriendlyNames friendlyNames = new FriendlyNames();

    @Getter
    @Setter
    public static class Ranking {
        private int candidateLimit = 20;
        private int topK = 5;
        private int minScore = 30;
        private boolean aiEnabled = false;
    }

    @Getter
    @Setter
    public static class Intent {
        private IntentInterpreterMode mode = IntentInterpreterMode.HEURISTIC;
    }

    @Getter
    @Setter
    public static class Completer {
        private long timeoutMs = 10_000L;
        private int maxTokens = 300;
        private double temperature = 0.0d;
        /** Threads of the default executor that runs provider calls. */
        private int poolSize = 4;
        private int queueCapacity = 100;
    }

    @Getter
    @Setter
    public static class Workflow {
        private int maxStackDepth = 5;
        private int maxStepExecutions = 100;
    }

    @Getter
    @Setter
    public static class Creation {
        private String workspaceId;
        private String creatorId;
    }

    @Getter
    @Setter
    public static class FriendlyNames {
        /** singular -> plural overrides, e.g. person: people. */
        private Map<String, String> pluralRules = new LinkedHashMap<>();
    }
}
