package com.reims.anomaly.model;

public record InvalidationDecision(boolean invalidate, String reason) {

    public static InvalidationDecision keep() {
        return new InvalidationDecision(false, "Cache valid");
    }

    public static InvalidationDecision because(String reason) {
        return new InvalidationDecision(true, reason);
    }
}
