package com.reims.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A trained detector model as persisted by the model cache. Immutable once stored
 * apart from useCount, lastUsedAt and active.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Trained model cache record")
public class CachedModel {

    @Schema(description = "SHA-256 hex of scope + model type + canonical config")
    private String cacheKey;

    private ModelScope scope;

    @Schema(description = "Model kind", example = "isolation_forest")
    private String modelType;

    @JsonIgnore
    private byte[] serializedModel;

    @Builder.Default
    private Map<String, Object> trainingMetadata = new HashMap<>();

    private Integer trainingDataSize;

    private Instant createdAt;
    private Instant expiresAt;
    private Instant lastUsedAt;

    private long useCount;

    private AccuracyMetrics accuracyMetrics;

    @Builder.Default
    private boolean active = true;

    /** Copy with its own metadata map; the payload bytes are shared and never mutated. */
    public CachedModel copy() {
        return toBuilder()
                .trainingMetadata(trainingMetadata != null ? new HashMap<>(trainingMetadata) : new HashMap<>())
                .build();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
