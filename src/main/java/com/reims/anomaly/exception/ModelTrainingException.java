package com.reims.anomaly.exception;

public class ModelTrainingException extends AnomalyDetectionException {
    public ModelTrainingException(String message) {
        super("MODEL_TRAINING_FAILED", message);
    }
    public ModelTrainingException(String message, Throwable cause) {
        super("MODEL_TRAINING_FAILED", message, cause);
    }
}
