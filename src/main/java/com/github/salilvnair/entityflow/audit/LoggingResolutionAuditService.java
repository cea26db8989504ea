package com.github.salilvnair.entityflow.audit;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingResolutionAuditService implements ResolutionAuditService {

    @Override
    public void audit(String stage, String sessionId, String payloadJson) {
        log.info("[{}] session={} payload={}", stage, sessionId, payloadJson);
    }
}
