package com.reims.anomaly.exception;

import lombok.Getter;

/**
 * Series too short for a computation. Never fatal: detectors turn it into an
 * unsuccessful run with this message as the reason.
 */
@Getter
public class InsufficientDataException extends AnomalyDetectionException {
    private final int required;
    private final int actual;

    public InsufficientDataException(int required, int actual) {
        super("INSUFFICIENT_DATA",
                String.format("Insufficient data: need at least %d points, got %d", required, actual));
        this.required = required;
        this.actual = actual;
    }
}
