package com.reims.anomaly.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
