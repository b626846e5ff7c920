package com.reims.anomaly.exception;

public class ConfigurationException extends AnomalyDetectionException {
    public ConfigurationException(String message) {
        super("INVALID_CONFIGURATION", message);
    }
}
