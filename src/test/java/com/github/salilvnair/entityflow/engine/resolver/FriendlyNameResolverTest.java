package com.github.salilvnair.entityflow.engine.resolver;

import com.github.salilvnair.entityflow.config.EntityFlowProperties;
import com.github.salilvnair.entityflow.engine.model.ResolutionConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FriendlyNameResolverTest {

    private final FriendlyNameResolver resolver = new FriendlyNameResolver(new EntityFlowProperties());

    @Test
    void fieldNamesBecomePluralPhrases() {
        assertEquals("line items", resolver.friendlyName("line_items", null));
        assertEquals("products", resolver.friendlyName("product_ids", null));
        assertEquals("categories", resolver.friendlyName("category", null));
        assertEquals("order boxes", resolver.friendlyName("order_box", null));
    }

    @Test
    void pluralizeFollowsEnglishEndings() {
        assertEquals("companies", resolver.pluralize("company"));
        assertEquals("days", resolver.pluralize("day"));
        assertEquals("boxes", resolver.pluralize("box"));
        assertEquals("knives", resolver.pluralize("knife"));
        assertEquals("shelves", resolver.pluralize("shelf"));
        assertEquals("items", resolver.pluralize("items"));
    }

    @Test
    void configuredRulesWin() {
        EntityFlowProperties properties = new EntityFlowProperties();
        properties.getFriendlyNames().getPluralRules().put("Person", "people");
        properties.getFriendlyNames().getPluralRules().put("sales person", "sales staff");
        FriendlyNameResolver custom = new FriendlyNameResolver(properties);

        assertEquals("people", custom.pluralize("person"));
        assertEquals("sales staff", custom.friendlyName("sales_person", null));
    }

    @Test
    void configOverridesDerivedNames() {
        ResolutionConfig config = ResolutionConfig.builder().model("billing.invoice_line").friendlyName("invoice lines").build();

        assertEquals("invoice lines", resolver.friendlyName("anything", config));
        assertEquals("Invoice line", resolver.entityName(config));
        assertEquals("Vendor", resolver.entityName(config.toBuilder().displayName("Vendor").build()));
        assertEquals("Entity", resolver.entityName(ResolutionConfig.builder().build()));
    }
}
