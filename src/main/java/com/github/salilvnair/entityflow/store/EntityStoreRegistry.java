package com.github.salilvnair.entityflow.store;

import com.github.salilvnair.entityflow.engine.exception.EntityFlowErrorCode;
import com.github.salilvnair.entityflow.engine.exception.EntityFlowException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class EntityStoreRegistry {

    private final Map<String, EntityStore> stores;

    public EntityStoreRegistry(List<EntityStore> stores) {
        this.stores = stores.stream()
                .collect(Collectors.toMap(s -> key(s.modelType()), Function.identity()));
    }

    public Optional<EntityStore> find(String modelType) {
        if (modelType == null || modelType.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(stores.get(key(modelType)));
    }

    public EntityStore require(String modelType) {
        if (modelType == null || modelType.isBlank()) {
            throw new EntityFlowException(EntityFlowErrorCode.CONFIGURATION_ERROR, "No model specified");
        }
        return find(modelType).orElseThrow(() -> new EntityFlowException(
                EntityFlowErrorCode.CONFIGURATION_ERROR,
                "No entity store registered for model " + modelType));
    }

    private static String key(String modelType) {
        return modelType.trim().toLowerCase(Locale.ROOT);
    }
}
