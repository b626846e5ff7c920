package com.reims.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.model-cache")
public class ModelCacheConfig {

    // When false every lookup trains and nothing is stored
    private boolean enabled = true;

    // Backing store: "aerospike" or "memory"
    private String store = "aerospike";

    private int ttlDays = 30;

    // Accuracy drop (absolute) beyond which a cached model should be retrained
    private double maxAccuracyDrop = 0.10;

    // How often expired records are deactivated
    private int maintenanceIntervalMinutes = 60;
}
