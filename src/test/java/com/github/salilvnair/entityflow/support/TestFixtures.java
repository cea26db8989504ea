package com.github.salilvnair.entityflow.support;

import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.ranking.DuplicateRanker;
import com.github.salilvnair.entityflow.engine.ranking.SimilarityScorer;
import com.github.salilvnair.entityflow.engine.resolver.BatchEntityResolver;
import com.github.salilvnair.entityflow.engine.resolver.ContextCreationDefaultsProvider;
import com.github.salilvnair.entityflow.engine.resolver.CustomEntityResolver;
import com.github.salilvnair.entityflow.engine.resolver.CustomResolverRegistry;
import com.github.salilvnair.entityflow.engine.resolver.EntityCreationService;
import com.github.salilvnair.entityflow.engine.resolver.EntityResolver;
import com.github.salilvnair.entityflow.engine.resolver.FriendlyNameResolver;
import com.github.salilvnair.entityflow.engine.resolver.IdentifierExtractor;
import com.github.salilvnair.entityflow.engine.resolver.ItemNameExtractor;
import com.github.salilvnair.entityflow.engine.subflow.SubflowOrchestrator;
import com.github.salilvnair.entityflow.engine.workflow.CollectAndCreateWorkflow;
import com.github.salilvnair.entityflow.engine.workflow.WorkflowDefinition;
import com.github.salilvnair.entityflow.engine.workflow.WorkflowRegistry;
import com.github.salilvnair.entityflow.engine.workflow.WorkflowRunner;
import com.github.salilvnair.entityflow.intent.HeuristicIntentInterpreter;
import com.github.salilvnair.entityflow.intent.IntentInterpreter;
import com.github.salilvnair.entityflow.store.EntityStore;
import com.github.salilvnair.entityflow.store.EntityStoreRegistry;
import com.github.salilvnair.entityflow.store.memory.InMemoryEntityStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.salilvnair.entityflow.support.TestConstants.MODEL_CUSTOMER;
import static com.github.salilvnair.entityflow.support.TestConstants.MODEL_PRODUCT;
import static com.github.salilvnair.entityflow.support.TestConstants.NAME;
import static com.github.salilvnair.entityflow.support.TestConstants.PRICE;
import static com.github.salilvnair.entityflow.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.entityflow.support.TestConstants.WORKFLOW_CREATE_PRODUCT;

/**
 * Wires the resolvers by hand over in-memory stores.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static WorkflowContext context() {
        return WorkflowContext.create(SESSION_ID);
    }

    public static WorkflowContext reply(WorkflowContext ctx, String userMessage) {
        ctx.addUserMessage(userMessage);
        return ctx;
    }

    public static InMemoryEntityStore customers(String... names) {
        InMemoryEntityStore store = new InMemoryEntityStore(MODEL_CUSTOMER,
                List.of(NAME, "email", "workspace_id", "created_by"));
        for (String name : names) {
            store.create(Map.of(NAME, name));
        }
        return store;
    }

    public static InMemoryEntityStore products(String... names) {
        InMemoryEntityStore store = new InMemoryEntityStore(MODEL_PRODUCT,
                List.of(NAME, PRICE, "sku", "workspace_id", "created_by"));
        for (String name : names) {
            store.create(Map.of(NAME, name));
        }
        return store;
    }

    public static CollectAndCreateWorkflow createProductWorkflow(EntityStore products) {
        return new CollectAndCreateWorkflow(WORKFLOW_CREATE_PRODUCT, "product", products,
                List.of(PRICE), List.of("sku"), NAME);
    }

    public static Engine engine(List<EntityStore> stores, List<WorkflowDefinition> workflows) {
        return new Engine(new HeuristicIntentInterpreter(), stores, workflows);
    }

    public static Engine engine(List<EntityStore> stores,
                                List<WorkflowDefinition> workflows,
                                List<CustomEntityResolver> customResolvers) {
        return new Engine(new HeuristicIntentInterpreter(), stores, workflows, customResolvers);
    }

    public static final class Engine {

        public final EntityFlowProperties properties = new EntityFlowProperties();
        public final RecordingAuditService audit = new RecordingAuditService();
        public final List<WorkflowDefinition> workflows;
        public final FriendlyNameResolver friendlyNames;
        public final WorkflowRegistry registry;
        public final WorkflowRunner runner;
        public final SubflowOrchestrator subflows;
        public final EntityResolver resolver;
        public final BatchEntityResolver batchResolver;

        public Engine(IntentInterpreter interpreter, List<EntityStore> stores, List<WorkflowDefinition> workflows) {
            this(interpreter, stores, workflows, List.of());
        }

        public Engine(IntentInterpreter interpreter,
                      List<EntityStore> stores,
                      List<WorkflowDefinition> workflows,
                      List<CustomEntityResolver> customResolvers) {
            this.workflows = new ArrayList<>(workflows);
            this.friendlyNames = new FriendlyNameResolver(properties);
            this.registry = new WorkflowRegistry(this.workflows);
            this.runner = new WorkflowRunner(registry, properties);
            this.subflows = new SubflowOrchestrator(registry, runner, friendlyNames, audit);
            EntityStoreRegistry storeRegistry = new EntityStoreRegistry(stores);
            EntityCreationService creation = new EntityCreationService(new ContextCreationDefaultsProvider(properties));
            CustomResolverRegistry customRegistry = new CustomResolverRegistry(customResolvers);
            DuplicateRanker ranker = new DuplicateRanker(new SimilarityScorer(), properties, Optional.empty());
            this.resolver = new EntityResolver(storeRegistry, ranker, interpreter, new IdentifierExtractor(),
                    creation, subflows, runner, friendlyNames, audit, customRegistry);
            this.batchResolver = new BatchEntityResolver(storeRegistry, interpreter, subflows, runner, creation,
                    new ItemNameExtractor(), friendlyNames, audit, customRegistry);
        }
    }
}
