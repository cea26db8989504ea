package com.github.salilvnair.entityflow.audit;

import com.github.salilvnair.entityflow.util.JsonUtil;

import java.util.LinkedHashMap;
import java.util.Map;

public interface ResolutionAuditService {

    void audit(String stage, String sessionId, String payloadJson);

    default void audit(ResolutionAuditStage stage, String sessionId, String payloadJson) {
        audit(stage.value(), sessionId, payloadJson);
    }

    default void audit(ResolutionAuditStage stage, String sessionId, Map<String, ?> payload) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (payload != null) {
            payload.forEach((k, v) -> normalized.put(k, v));
        }
        audit(stage.value(), sessionId, JsonUtil.toJson(normalized));
    }
}
