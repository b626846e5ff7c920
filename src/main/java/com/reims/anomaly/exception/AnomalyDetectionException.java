package com.reims.anomaly.exception;

import lombok.Getter;

@Getter
public abstract class AnomalyDetectionException extends RuntimeException {
    private final String errorCode;
    protected AnomalyDetectionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected AnomalyDetectionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
