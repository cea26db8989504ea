package com.github.salilvnair.entityflow.audit;

public enum ResolutionAuditStage {
    RESOLUTION_STARTED,
    DELEGATED_TO_CUSTOM_RESOLVER,
    EXACT_MATCH_FOUND,
    DUPLICATES_PRESENTED,
    DUPLICATE_CHOSEN,
    CREATE_CONFIRMATION_REQUESTED,
    CREATION_DECLINED,
    ENTITY_CREATED,
    RESOLUTION_FAILED,
    BATCH_PARTITIONED,
    BATCH_CONFIRMATION_REQUESTED,
    BATCH_MODIFIED,
    BATCH_COMPLETED,
    SUBFLOW_STARTED,
    SUBFLOW_COMPLETED,
    SUBFLOW_FAILED,
    PROVIDER_FALLBACK;

    public String value() {
        return name();
    }
}
