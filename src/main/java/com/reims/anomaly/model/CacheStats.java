package com.reims.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {
    private long totalModels;
    private long activeModels;
    private long expiredModels;
    private long totalUses;
    private boolean cacheEnabled;
}
