package com.github.salilvnair.entityflow.store.memory;

import com.github.salilvnair.entityflow.store.EntityQuery;
import com.github.salilvnair.entityflow.store.EntityRecord;
import com.github.salilvnair.entityflow.store.EntityStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store, handy for prototypes and tests. Only fields listed as writable are kept on create.
 */
public class InMemoryEntityStore implements EntityStore {

    private final String modelType;
    private final List<String> writableFields;
    private final Map<Long, EntityRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryEntityStore(String modelType, List<String> writableFields) {
        this.modelType = modelType;
        this.writableFields = List.copyOf(writableFields);
    }

    @Override
    public String modelType() {
        return modelType;
    }

    @Override
    public Optional<EntityRecord> findOne(EntityQuery query) {
        return ordered().stream().filter(query::matches).findFirst();
    }

    @Override
    public List<EntityRecord> findMany(EntityQuery query, int limit) {
        return ordered().stream().filter(query::matches).limit(Math.max(0, limit)).toList();
    }

    @Override
    public Optional<EntityRecord> findById(Object id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(records.get(Long.valueOf(String.valueOf(id))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public EntityRecord create(Map<String, Object> fields) {
        Map<String, Object> kept = new LinkedHashMap<>();
        fields.forEach((k, v) -> {
            if (writableFields.contains(k) && v != null) {
                kept.put(k, v);
            }
        });
        long id = sequence.incrementAndGet();
        EntityRecord record = new EntityRecord(id, kept);
        records.put(id, record);
        return record;
    }

    @Override
    public List<String> listWritableFields() {
        return writableFields;
    }

    public int size() {
        return records.size();
    }

    private List<EntityRecord> ordered() {
        List<EntityRecord> all = new ArrayList<>(records.values());
        all.sort((a, b) -> Long.compare((Long) a.id(), (Long) b.id()));
        return all;
    }
}
