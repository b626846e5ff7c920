package com.reims.anomaly.engine;

import lombok.Builder;
import lombok.Data;

/**
 * Per-evaluation settings passed to every detector, for values that can
 * differ between requests rather than come from static configuration.
 */
@Data
@Builder
public class DetectionContext {

    // Entity the series belongs to; scopes trained models
    private String entityId;

    // Whether the seasonal detector may use the seasonal component
    @Builder.Default
    private boolean useSeasonality = true;

    // Whether model-based detectors may read and write the model cache
    @Builder.Default
    private boolean useModelCache = true;
}
