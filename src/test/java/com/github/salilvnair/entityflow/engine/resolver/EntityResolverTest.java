package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.audit.ResolutionAuditStage;
import com.github.salilvnair.entityflow.engine.constants.ContextKeys;
import com.github.salilvnair.entityflow.engine.context.FieldResolutionState;
import com.github.salilvnair.entityflow.engine.context.WorkflowContext;
import com.github.salilvnair.entityflow.engine.model.ActionResult;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;
import com.github.salilvnair.entityflow.store.EntityRecord;
import com.github.salilvnair.entityflow.store.memory.InMemoryEntityStore;
import com.github.salilvnair.entityflow.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.entityflow.support.TestConstants.BOOM;
import static com.github.salilvnair.entityflow.support.TestConstants.EMAIL;
import static com.github.salilvnair.entityflow.support.TestConstants.FIELD_CUSTOMER;
import static com.github.salilvnair.entityflow.support.TestConstants.FIELD_PRODUCT;
import static com.github.salilvnair.entityflow.support.TestConstants.INVOICE_NUMBER;
import static com.github.salilvnair.entityflow.support.TestConstants.MODEL_CUSTOMER;
import static com.github.salilvnair.entityflow.support.TestConstants.MODEL_PRODUCT;
import static com.github.salilvnair.entityflow.support.TestConstants.NAME;
import static com.github.salilvnair.entityflow.support.TestConstants.NO;
import static com.github.salilvnair.entityflow.support.TestConstants.PRICE;
import static com.github.salilvnair.entityflow.support.TestConstants.WORKFLOW_CREATE_PRODUCT;
import static com.github.salilvnair.entityflow.support.TestConstants.YES;
import static com.github.salilvnair.entityflow.support.TestFixtures.reply;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityResolverTest {

    private static final ResolutionConfig CUSTOMER = ResolutionConfig.builder()
            .model(MODEL_CUSTOMER)
            .searchField(NAME)
            .build();

    @Test
    void exactMatchIsAdoptedWithoutAsking() {
        InMemoryEntityStore customers = TestFixtures.customers("Acme Corp");
        TestFixtures.Engine engine = TestFixtures.engine(List.of(customers), List.of());
        WorkflowContext ctx = TestFixtures.context();

        ActionResult result = engine.resolver.resolve(FIELD_CUSTOMER, CUSTOMER, "acme corp", ctx);

        assertInstanceOf(ActionResult.Success.class, result);
        assertEquals(1L, ctx.getCollectedData().get(FIELD_CUSTOMER));
        assertInstanceOf(FieldResolutionState.Done.class, ctx.fieldState(FIELD_CUSTOMER));
    }

    @Test
    void exactMatchWinsEvenWhenDuplicatesAreChecked() {
        InMemoryEntityStore products = TestFixtures.products("MacBook Pro", "MacBook Pro 16");
        TestFixtures.Engine engine = TestFixtures.engine(List.of(products), List.of());
        WorkflowContext ctx = TestFixtures.context();
        ResolutionConfig config = ResolutionConfig.builder()
                .model(MODEL_PRODUCT)
                .searchField(NAME)
                .checkDuplicates(true)
                .askOnDuplicate(true)
                .build();

        ActionResult result = engine.resolver.resolve(FIELD_PRODUCT, config, "macbook pro", ctx);

        assertInstanceOf(ActionResult.Success.class, result);
        assertEquals(1L, ctx.getCollectedData().get(FIELD_PRODUCT));
        assertInstanceOf(FieldResolutionState.Done.class, ctx.fieldState(FIELD_PRODUCT));
        assertTrue(engine.audit.stages().contains(ResolutionAuditStage.EXACT_MATCH_FOUND.value()));
        assertFalse(engine.audit.stages().contains(ResolutionAuditStage.DUPLICATES_PRESENTED.value()));
    }

    @Test
    void includeFieldsProjectIdWithRequestedValues() {
        InMemoryEntityStore customers = TestFixtures.customers();
        customers.create(Map.of(NAME, "Acme Corp", EMAIL, "billing@acme.test"));
        TestFixtures.Engine engine = TestFixtures.engine(List.of(customers), List.of());
        WorkflowContext ctx = TestFixtures.context();
        ResolutionConfig config = CUSTOMER.toBuilder().includeField(EMAIL).build();

        engine.resolver.resolve(FIELD_CUSTOMER, config, "Acme Corp", ctx);

        assertEquals(Map.of("id", 1L, EMAIL, "billing@acme.test"), ctx.getCollectedData().get(FIELD_CUSTOMER));
    }

    @Test
    void similarEntitiesArePresentedAndChosenByNumber() {
        InMemoryEntityStore products = TestFixtures.products("MacBook Pro 16", "MacBook Air");
        TestFixtures.Engine engine = TestFixtures.engine(List.of(products), List.of());
        WorkflowContext ctx = TestFixtures.context();
        ResolutionConfig config = ResolutionConfig.builder()
                .model(MODEL_PRODUCT)
                .searchField(NAME)
                .checkDuplicates(true)
                .askOnDuplicate(true)
                .build();

        ActionResult first = engine.resolver.resolve(FIELD_PRODUCT, config, "MacBook", ctx);

        assertTrue(first.needsUserInput());
        assertTrue(first.text().startsWith("Found 2 similar products:"));
        assertTrue(first.text().contains("1. **MacBook Pro 16** (Match: 85%)"));
        assertInstanceOf(FieldResolutionState.AwaitingDuplicateChoice.class, ctx.fieldState(FIELD_PRODUCT));

        ActionResult second = engine.resolver.resolve(FIELD_PRODUCT, config, "MacBook", reply(ctx, "2"));

        assertInstanceOf(ActionResult.Success.class, second);
        assertEquals(2L, ctx.getCollectedData().get(FIELD_PRODUCT));
        assertEquals(2, products.size());
    }

    @Test
    void unclearDuplicateReplyKeepsWaiting() {
        InMemoryEntityStore products = TestFixtures.products("MacBook Pro 16");
        TestFixtures.Engine engine = TestFixtures.engine(List.of(products), List.of());
        WorkflowContext ctx = TestFixtures.context();
        ResolutionConfig config = ResolutionConfig.builder()
                .model(MODEL_PRODUCT)
                .checkDuplicates(true)
                .askOnDuplicate(true)
                .build();

        engine.resolver.resolve(FIELD_PRODUCT, config, "MacBook", ctx);
        ActionResult again = engine.resolver.resolve(FIELD_PRODUCT, config, "MacBook", reply(ctx, "hmm"));

        assertTrue(again.needsUserInput());
        assertTrue(again.text().startsWith("I didn't understand that."));
        assertInstanceOf(FieldResolutionState.AwaitingDuplicateChoice.class, ctx.fieldState(FIELD_PRODUCT));
    }

    @Test
    void decliningCreationCancelsAndResetsTheField() {
        InMemoryEntityStore customers = TestFixtures.customers();
        TestFixtures.Engine engine = TestFixtures.engine(List.of(customers), List.of());
        WorkflowContext ctx = TestFixtures.context();

        ActionResult ask = engine.resolver.resolve(FIELD_CUSTOMER, CUSTOMER, "Globex", ctx);
        assertEquals("Customer 'Globex' doesn't exist. Would you like to create it? (yes/no)", ask.text());

        ActionResult declined = engine.resolver.resolve(FIELD_CUSTOMER, CUSTOMER, "Globex", reply(ctx, NO));

        assertInstanceOf(ActionResult.Failure.class, declined);
        assertEquals("Customer creation cancelled by user", declined.text());
        assertInstanceOf(FieldResolutionState.Idle.class, ctx.fieldState(FIELD_CUSTOMER));
        assertEquals(0, customers.size());
    }

    @Test
    void confirmedCreationWithoutSubflowUsesDefaults() {
        InMemoryEntityStore customers = TestFixtures.customers();
        TestFixtures.Engine engine = TestFixtures.engine(List.of(customers), List.of());
        WorkflowContext ctx = TestFixtures.context();
        ctx.set("workspace_id", 7);

        engine.resolver.resolve(FIELD_CUSTOMER, CUSTOMER, "Globex", ctx);
        ActionResult created = engine.resolver.resolve(FIELD_CUSTOMER, CUSTOMER, "Globex", reply(ctx, YES));

        assertInstanceOf(ActionResult.Success.class, created);
        assertEquals(1, customers.size());
        assertEquals(7, customers.findById(1L).orElseThrow().value("workspace_id"));
        assertEquals(1L, ctx.getCollectedData().get(FIELD_CUSTOMER));
    }

    @Test
    void nonInteractiveConfigCreatesImmediately() {
        InMemoryEntityStore customers = TestFixtures.customers();
        TestFixtures.Engine engine = TestFixtures.engine(List.of(customers), List.of());
        WorkflowContext ctx = TestFixtures.context();
        ResolutionConfig config = CUSTOMER.toBuilder().interactive(false).confirmBeforeCreate(false).build();

        ActionResult result = engine.resolver.resolve(FIELD_CUSTOMER, config, "Initech", ctx);

        assertInstanceOf(ActionResult.Success.class, result);
        assertEquals(1, customers.size());
    }

    @Test
    void structuredIdentifierIsSearchedAndRemembered() {
        InMemoryEntityStore customers = TestFixtures.customers();
        customers.create(Map.of(NAME, "John", EMAIL, "john@x.com"));
        TestFixtures.Engine engine = TestFixtures.engine(List.of(customers), List.of());
        WorkflowContext ctx = TestFixtures.context();
        ResolutionConfig config = ResolutionConfig.builder().model(MODEL_CUSTOMER).searchField(EMAIL).build();

        ActionResult result = engine.resolver.resolve(FIELD_CUSTOMER, config,
                Map.of(EMAIL, "john@x.com", NAME, "John"), ctx);

        assertInstanceOf(ActionResult.Success.class, result);
        assertEquals("john@x.com", ctx.extractedData(FIELD_CUSTOMER).get(EMAIL));
    }

    @Test
    void missingIdentifierAsksWhichEntity() {
        TestFixtures.Engine engine = TestFixtures.engine(List.of(TestFixtures.customers()), List.of());

        ActionResult result = engine.resolver.resolve(FIELD_CUSTOMER, CUSTOMER, null, TestFixtures.context());

        assertEquals("Which customer should I use?", result.text());
    }

    @Test
    void unknownModelFailsWithoutTouchingContext() {
        TestFixtures.Engine engine = TestFixtures.engine(List.of(), List.of());
        WorkflowContext ctx = TestFixtures.context();

        ActionResult result = engine.resolver.resolve(FIELD_CUSTOMER, CUSTOMER, "Acme", ctx);

        assertInstanceOf(ActionResult.Failure.class, result);
        assertTrue(ctx.getFieldStates().isEmpty());
    }

    @Test
    void creationSubflowCollectsDetailsOverSeveralTurns() {
        InMemoryEntityStore products = TestFixtures.products();
        TestFixtures.Engine engine = TestFixtures.engine(List.of(products),
                List.of(TestFixtures.createProductWorkflow(products)));
        WorkflowContext ctx = TestFixtures.context();
        ctx.getCollectedData().put(INVOICE_NUMBER, "INV-1");
        ResolutionConfig config = ResolutionConfig.builder()
                .model(MODEL_PRODUCT)
                .subflow(WORKFLOW_CREATE_PRODUCT)
                .includeField(PRICE)
                .build();

        engine.resolver.resolve(FIELD_PRODUCT, config, "Widget", ctx);
        ActionResult question = engine.resolver.resolve(FIELD_PRODUCT, config, "Widget", reply(ctx, YES));

        assertEquals("What is the price for product 'Widget'?", question.text());
        assertTrue(ctx.inSubflow());
        assertFalse(ctx.getCollectedData().containsKey(INVOICE_NUMBER));

        ActionResult done = engine.resolver.resolve(FIELD_PRODUCT, config, "Widget", reply(ctx, "12.50"));

        assertInstanceOf(ActionResult.Success.class, done);
        assertFalse(ctx.inSubflow());
        assertTrue(ctx.getWorkflowStack().isEmpty());
        assertEquals("INV-1", ctx.getCollectedData().get(INVOICE_NUMBER));
        @SuppressWarnings("unchecked")
        Map<String, Object> product = (Map<String, Object>) ctx.getCollectedData().get(FIELD_PRODUCT);
        assertEquals(1L, product.get("id"));
        assertEquals(new BigDecimal("12.50"), product.get(PRICE));
        assertEquals(new BigDecimal("12.50"), products.findById(1L).orElseThrow().value(PRICE));
        assertFalse(ctx.has("entity_id"));
    }

    @Test
    void unexpectedErrorRollsBackTheTurnAndOffersARetry() {
        InMemoryEntityStore customers = new InMemoryEntityStore(MODEL_CUSTOMER, List.of(NAME)) {
            @Override
            public EntityRecord create(Map<String, Object> fields) {
                throw new IllegalStateException(BOOM);
            }
        };
        TestFixtures.Engine engine = TestFixtures.engine(List.of(customers), List.of());
        WorkflowContext ctx = TestFixtures.context();
        ctx.getCollectedData().put(INVOICE_NUMBER, "INV-3");

        engine.resolver.resolve(FIELD_CUSTOMER, CUSTOMER, "Globex", ctx);
        ActionResult result = engine.resolver.resolve(FIELD_CUSTOMER, CUSTOMER, "Globex", reply(ctx, YES));

        ActionResult.NeedsUserInput retry = assertInstanceOf(ActionResult.NeedsUserInput.class, result);
        assertEquals("Something went wrong while resolving the customer. Would you like to try again?", retry.text());
        assertEquals(ContextKeys.AWAITING_RETRY, retry.metadata().get(ContextKeys.META_AWAITING));
        assertEquals(BOOM, retry.metadata().get(ContextKeys.META_ERROR));
        assertInstanceOf(FieldResolutionState.Idle.class, ctx.fieldState(FIELD_CUSTOMER));
        assertFalse(ctx.getCollectedData().containsKey(FIELD_CUSTOMER));
        assertEquals("INV-3", ctx.getCollectedData().get(INVOICE_NUMBER));
        assertTrue(engine.audit.stages().contains(ResolutionAuditStage.RESOLUTION_FAILED.value()));
    }

    @Test
    void customResolverTakesOverTheField() {
        CustomEntityResolver vendors = new CustomEntityResolver() {
            @Override
            public String id() {
                return "vendor_lookup";
            }

            @Override
            public ActionResult resolve(String field, ResolutionConfig config, Object identifier, WorkflowContext ctx) {
                ctx.getCollectedData().put(field, 42L);
                return ActionResult.success("Vendor " + identifier);
            }
        };
        TestFixtures.Engine engine = TestFixtures.engine(List.of(), List.of(), List.of(vendors));
        WorkflowContext ctx = TestFixtures.context();
        ResolutionConfig config = ResolutionConfig.builder().model("vendor").resolver("Vendor_Lookup").build();

        ActionResult result = engine.resolver.resolve("vendor", config, "Initech", ctx);

        assertEquals(ActionResult.success("Vendor Initech"), result);
        assertEquals(42L, ctx.getCollectedData().get("vendor"));
        assertEquals(List.of(ResolutionAuditStage.DELEGATED_TO_CUSTOM_RESOLVER.value()), engine.audit.stages());
    }

    @Test
    void unknownCustomResolverFails() {
        TestFixtures.Engine engine = TestFixtures.engine(List.of(TestFixtures.customers("Acme")), List.of());
        WorkflowContext ctx = TestFixtures.context();
        ResolutionConfig config = CUSTOMER.toBuilder().resolver("crm_lookup").build();

        ActionResult result = engine.resolver.resolve(FIELD_CUSTOMER, config, "Acme", ctx);

        assertEquals(ActionResult.failure("No custom resolver registered as crm_lookup"), result);
        assertFalse(ctx.getCollectedData().containsKey(FIELD_CUSTOMER));
    }
}
