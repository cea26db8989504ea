package com.github.salilvnair.entityflow.config;

import com.github.salilvnair.entityflow.audit.LoggingResolutionAuditService;
import com.github.salilvnair.entityflow.audit.ResolutionAuditService;
import com.github.salilvnair.entityflow.engine.ranking.AiCandidateReRanker;
import com.github.salilvnair.entityflow.engine.ranking.CandidateReRanker;
import com.github.salilvnair.entityflow.engine.resolver.ContextCreationDefaultsProvider;
import com.github.salilvnair.entityflow.engine.resolver.CreationDefaultsProvider;
import com.github.salilvnair.entityflow.intent.AiIntentInterpreter;
import com.github.salilvnair.entityflow.intent.FallbackIntentInterpreter;
import com.github.salilvnair.entityflow.intent.HeuristicIntentInterpreter;
import com.github.salilvnair.entityflow.intent.IntentInterpreter;
import com.github.salilvnair.entityflow.intent.IntentInterpreterMode;
import com.github.salilvnair.entityflow.llm.core.GuardedTextCompleter;
import com.github.salilvnair.entityflow.llm.core.TextCompleter;
import com.github.salilvnair.entityflow.repo.WorkflowSessionRepository;
import com.github.salilvnair.entityflow.store.JpaSessionStore;
import com.github.salilvnair.entityflow.store.SessionStore;
import com.github.salilvnair.entityflow.store.memory.InMemorySessionStore;
import com.github.salilvnair.entityflow.template.ThymeleafTemplateRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Slf4j
@AutoConfiguration
@ComponentScan(basePackages = "com.github.salilvnair.entityflow")
public class EntityFlowAutoConfiguration {

    /** Bean name of the executor that runs provider calls; define a bean with this name to replace it. */
    public static final String COMPLETION_EXECUTOR = "entityFlowCompletionExecutor";

    @Bean
    @ConditionalOnMissingBean
    public ResolutionAuditService resolutionAuditService() {
        return new LoggingResolutionAuditService();
    }

    @Bean
    @ConditionalOnMissingBean
    public CreationDefaultsProvider creationDefaultsProvider(EntityFlowProperties properties) {
        return new ContextCreationDefaultsProvider(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "entityflow", name = "session-store", havingValue = "memory", matchIfMissing = true)
    public SessionStore inMemorySessionStore() {
        return new InMemorySessionStore();
    }

    @Bean(name = COMPLETION_EXECUTOR)
    @ConditionalOnMissingBean(name = COMPLETION_EXECUTOR)
    public Executor entityFlowCompletionExecutor(EntityFlowProperties properties) {
        EntityFlowProperties.Completer settings = properties.getCompleter();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getPoolSize());
        executor.setMaxPoolSize(settings.getPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("entityflow-completer-");
        executor.setDaemon(true);
        log.debug("Completion executor configured: pool={}, queue={}", settings.getPoolSize(), settings.getQueueCapacity());
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public IntentInterpreter intentInterpreter(EntityFlowProperties properties,
                                               ObjectProvider<TextCompleter> completer,
                                               ThymeleafTemplateRenderer renderer,
                                               @Qualifier(COMPLETION_EXECUTOR) Executor completionExecutor) {
        HeuristicIntentInterpreter heuristic = new HeuristicIntentInterpreter();
        TextCompleter provider = completer.getIfAvailable();
        if (properties.getIntent().getMode() != IntentInterpreterMode.AI_THEN_HEURISTIC) {
            return heuristic;
        }
        if (provider == null) {
            log.warn("entityflow.intent.mode is AI_THEN_HEURISTIC but no TextCompleter bean exists, using heuristics only");
            return heuristic;
        }
        EntityFlowProperties.Completer settings = properties.getCompleter();
        AiIntentInterpreter ai = new AiIntentInterpreter(
                new GuardedTextCompleter(provider, settings.getTimeoutMs(), completionExecutor), renderer, settings);
        return new FallbackIntentInterpreter(ai, heuristic);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "entityflow.ranking", name = "ai-enabled", havingValue = "true")
    public CandidateReRanker candidateReRanker(EntityFlowProperties properties,
                                               ObjectProvider<TextCompleter> completer,
                                               ThymeleafTemplateRenderer renderer,
                                               @Qualifier(COMPLETION_EXECUTOR) Executor completionExecutor) {
        TextCompleter provider = completer.getIfAvailable();
        if (provider == null) {
            throw new IllegalStateException("entityflow.ranking.ai-enabled=true requires a TextCompleter bean");
        }
        EntityFlowProperties.Completer settings = properties.getCompleter();
        return new AiCandidateReRanker(new GuardedTextCompleter(provider, settings.getTimeoutMs(), completionExecutor),
                renderer, settings);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "entityflow", name = "session-store", havingValue = "jpa")
    @EntityScan(basePackages = "com.github.salilvnair.entityflow.entity")
    @EnableJpaRepositories(basePackages = "com.github.salilvnair.entityflow.repo")
    static class JpaSessionStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public SessionStore jpaSessionStore(WorkflowSessionRepository repository) {
            return new JpaSessionStore(repository);
        }
    }
}
