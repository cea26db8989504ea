package com.github.salilvnair.entityflow.store;

import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import com.github.salilvnair.entityflow.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityStoreRegistryTest {

    private final EntityStore customers = TestFixtures.customers();
    private final EntityStoreRegistry registry = new EntityStoreRegistry(List.of(customers, TestFixtures.products()));

    @Test
    void looksUpModelsIgnoringCase() {
        assertSame(customers, registry.require(" Customer "));
        assertFalse(registry.find("vendor").isPresent());
        assertFalse(registry.find(null).isPresent());
    }

    @Test
    void missingModelIsAConfigurationError() {
        EntityFlowException unknown = assertThrows(EntityFlowException.class, () -> registry.require("vendor"));
        EntityFlowException blank = assertThrows(EntityFlowException.class, () -> registry.require(""));

        assertTrue(unknown.is(EntityFlowErrorCode.CONFIGURATION_ERROR));
        assertTrue(blank.is(EntityFlowErrorCode.CONFIGURATION_ERROR));
        assertFalse(unknown.isRecoverable());
    }
}
