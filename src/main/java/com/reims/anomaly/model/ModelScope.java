package com.reims.anomaly.model;

/**
 * What a trained model is specific to. A null component means "all".
 */
public record ModelScope(String entityId, String field) {

    public static ModelScope of(String entityId, String field) {
        return new ModelScope(entityId, field);
    }

    public String canonical() {
        return "entity:" + (entityId != null ? entityId : "all") + "|field:" + (field != null ? field : "all");
    }

    /** True when this scope's non-null components all match {@code other}. */
    public boolean covers(ModelScope other) {
        return (entityId == null || entityId.equals(other.entityId()))
                && (field == null || field.equals(other.field()));
    }
}
