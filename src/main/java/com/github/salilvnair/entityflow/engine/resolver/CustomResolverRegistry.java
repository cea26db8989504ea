package com.github.salilvnair.entityflow.engine.resolver;

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
public class CustomResolverRegistry {

    private final Map<String, CustomEntityResolver> resolvers;

    public CustomResolverRegistry(List<CustomEntityResolver> resolvers) {
        this.resolvers = resolvers.stream()
                .collect(Collectors.toMap(r -> key(r.id()), Function.identity()));
    }

    public Optional<CustomEntityResolver> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(resolvers.get(key(id)));
    }

    public CustomEntityResolver require(String id) {
        return find(id).orElseThrow(() -> new EntityFlowException(
                EntityFlowErrorCode.CONFIGURATION_ERROR,
                "No custom resolver registered as " + id));
    }

    private static String key(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
