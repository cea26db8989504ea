package com.github.salilvnair.entityflow.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class EntityFlowException extends RuntimeException {

    private final EntityFlowErrorCode errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public EntityFlowException(EntityFlowErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code;
        this.recoverable = code.recoverable();
    }

    public EntityFlowException(EntityFlowErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code;
        this.recoverable = code.recoverable();
    }

    public EntityFlowException(EntityFlowErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code;
        this.recoverable = code.recoverable();
    }

    public EntityFlowException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

    public boolean is(EntityFlowErrorCode code) {
        return errorCode == code;
    }
}
