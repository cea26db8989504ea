package com.github.salilvnair.entityflow.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence and search for one entity type. Implementations are registered as beans and
 * looked up by {@link #modelType()}.
 */
public interface EntityStore {

    String modelType();

    Optional<EntityRecord> findOne(EntityQuery query);

    List<EntityRecord> findMany(EntityQuery query, int limit);

    Optional<EntityRecord> findById(Object id);

    EntityRecord create(Map<String, Object> fields);

    List<String> listWritableFields();
}
