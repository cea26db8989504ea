package com.github.salilvnair.entityflow.config;

import com.github.salilvnair.entityflow.engine.ranking.CandidateReRanker;
import com.github.salilvnair.entityflow.engine.resolver.BatchEntityResolver;
import com.github.salilvnair.entityflow.engine.resolver.EntityResolver;
import com.github.salilvnair.entityflow.intent.FallbackIntentInterpreter;
import com.github.salilvnair.entityflow.intent.HeuristicIntentInterpreter;
import com.github.salilvnair.entityflow.intent.IntentInterpreter;
import com.github.salilvnair.entityflow.llm.core.TextCompleter;
import com.github.salilvnair.entityflow.store.SessionStore;
import com.github.salilvnair.entityflow.store.memory.InMemorySessionStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityFlowAutoConfigurationTest {

    private static final TextCompleter ECHO = (prompt, maxTokens, temperature) -> "{}";

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class, EntityFlowAutoConfiguration.class));

    @Test
    void defaultsToHeuristicsAndMemorySessions() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(EntityResolver.class));
            assertNotNull(context.getBean(BatchEntityResolver.class));
            assertInstanceOf(HeuristicIntentInterpreter.class, context.getBean(IntentInterpreter.class));
            assertInstanceOf(InMemorySessionStore.class, context.getBean(SessionStore.class));
            assertTrue(context.getBeansOfType(CandidateReRanker.class).isEmpty());
        });
    }

    @Test
    void bindsProperties() {
        contextRunner
                .withPropertyValues("entityflow.workflow.max-stack-depth=3", "entityflow.ranking.top-k=2")
                .run(context -> {
                    EntityFlowProperties properties = context.getBean(EntityFlowProperties.class);
                    assertEquals(3, properties.getWorkflow().getMaxStackDepth());
                    assertEquals(2, properties.getRanking().getTopK());
                });
    }

    @Test
    void aiModeWrapsTheHeuristicsWhenACompleterExists() {
        contextRunner
                .withPropertyValues("entityflow.intent.mode=AI_THEN_HEURISTIC")
                .withBean(TextCompleter.class, () -> ECHO)
                .run(context -> assertInstanceOf(FallbackIntentInterpreter.class, context.getBean(IntentInterpreter.class)));
    }

    @Test
    void aiModeWithoutACompleterStaysHeuristic() {
        contextRunner
                .withPropertyValues("entityflow.intent.mode=AI_THEN_HEURISTIC")
                .run(context -> assertInstanceOf(HeuristicIntentInterpreter.class, context.getBean(IntentInterpreter.class)));
    }

    @Test
    void aiRankingRequiresACompleter() {
        contextRunner
                .withPropertyValues("entityflow.ranking.ai-enabled=true")
                .run(context -> assertNotNull(context.getStartupFailure()));
        contextRunner
                .withPropertyValues("entityflow.ranking.ai-enabled=true")
                .withBean(TextCompleter.class, () -> ECHO)
                .run(context -> assertNotNull(context.getBean(CandidateReRanker.class)));
    }

    @Test
    void hostSessionStoreWins() {
        InMemorySessionStore hostStore = new InMemorySessionStore();
        contextRunner
                .withBean(SessionStore.class, () -> hostStore)
                .run(context -> assertSame(hostStore, context.getBean(SessionStore.class)));
    }

    @Test
    void providesABoundedCompletionExecutor() {
        contextRunner
                .withPropertyValues("entityflow.completer.pool-size=2")
                .run(context -> {
                    ThreadPoolTaskExecutor executor = assertInstanceOf(ThreadPoolTaskExecutor.class,
                            context.getBean(EntityFlowAutoConfiguration.COMPLETION_EXECUTOR));
                    assertEquals(2, executor.getMaxPoolSize());
                });
    }

    @Test
    void hostCompletionExecutorWins() {
        Executor direct = Runnable::run;
        contextRunner
                .withBean(EntityFlowAutoConfiguration.COMPLETION_EXECUTOR, Executor.class, () -> direct)
                .withPropertyValues("entityflow.intent.mode=AI_THEN_HEURISTIC")
                .withBean(TextCompleter.class, () -> ECHO)
                .run(context -> {
                    assertSame(direct, context.getBean(EntityFlowAutoConfiguration.COMPLETION_EXECUTOR));
                    assertInstanceOf(FallbackIntentInterpreter.class, context.getBean(IntentInterpreter.class));
                });
    }
}
