package com.github.salilvnair.entityflow.engine.constants;

public final class ContextKeys {

    private ContextKeys() {
    }

    public static final String ENTITY_ID = "entity_id";
    public static final String ID_SUFFIX = "_id";
    public static final String WORKSPACE_ID = "workspace_id";
    public static final String USER_ID = "user_id";

    public static final String META_FIELD = "field";
    public static final String META_ERROR = "error";
    public static final String META_AWAITING = "awaiting";
    public static final String META_CANDIDATES = "candidates";
    public static final String META_MISSING = "missing";
    public static final String META_STEP = "step";
    public static final String META_SUBFLOW = "subflow";
    public static final String META_SUBFLOW_ACTIVE = "subflow_active";

    public static final String DATA_ENTITY = "entity";
    public static final String DATA_SUBFLOW_COMPLETED = "subflow_completed";

    public static final String AWAITING_DUPLICATE_CHOICE = "duplicate_choice";
    public static final String AWAITING_CREATE_CONFIRMATION = "create_confirmation";
    public static final String AWAITING_BATCH_CONFIRMATION = "batch_confirmation";
    public static final String AWAITING_RETRY = "retry";
    public static final String AWAITING_FIELD_VALUE = "field_value";

    public static String idSlot(String name) {
        return name + ID_SUFFIX;
    }
}
