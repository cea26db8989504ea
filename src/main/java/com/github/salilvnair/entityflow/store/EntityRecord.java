package com.github.salilvnair.entityflow.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EntityRecord(Object id, Map<String, Object> fields) {

    public EntityRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object value(String field) {
        if ("id".equals(field)) {
            return id;
        }
        return fields.get(field);
    }

    public String text(String field) {
        Object value = value(field);
        return value == null ? null : String.valueOf(value);
    }

    /** Fields plus the id, as handed to users of the resolved entity. */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.putAll(fields);
        return map;
    }
}
