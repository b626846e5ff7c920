package com.reims.anomaly.controller;

import com.reims.anomaly.exception.CachedModelNotFoundException;
import com.reims.anomaly.model.CacheStats;
import com.reims.anomaly.model.CachedModel;
import com.reims.anomaly.model.ModelScope;
import com.reims.anomaly.service.ModelCacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/models/cache")
@Tag(name = "Model Cache", description = "Trained model cache statistics and invalidation")
public class ModelCacheController {

    private final ModelCacheService modelCacheService;

    public ModelCacheController(ModelCacheService modelCacheService) {
        this.modelCacheService = modelCacheService;
    }

    @Operation(summary = "Cache statistics",
            description = "Total, active and expired cached models, and how often they were reused.")
    @GetMapping("/stats")
    public ResponseEntity<CacheStats> stats() {
        return ResponseEntity.ok(modelCacheService.getCacheStats());
    }

    @Operation(summary = "Invalidate cached models",
            description = "Marks matching active models inactive so the next evaluation retrains them. " +
                    "Omitted parameters match everything.")
    @PostMapping("/invalidate")
    public ResponseEntity<Map<String, Object>> invalidate(
            @Parameter(description = "Entity ID", example = "PROP-001")
            @RequestParam(required = false) String entityId,
            @Parameter(description = "Account field", example = "operating_expenses")
            @RequestParam(required = false) String field,
            @Parameter(description = "Model type", example = "isolation_forest")
            @RequestParam(required = false) String modelType) {

        ModelScope scope = entityId == null && field == null ? null : ModelScope.of(entityId, field);
        int count = modelCacheService.invalidate(scope, modelType);
        return ResponseEntity.ok(Map.of("invalidated", count));
    }

    @Operation(summary = "Cached model metadata",
            description = "Returns the cache record without the serialized model.")
    @GetMapping("/{cacheKey}")
    public ResponseEntity<CachedModel> get(
            @Parameter(description = "SHA-256 cache key")
            @PathVariable String cacheKey) {
        return modelCacheService.find(cacheKey)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new CachedModelNotFoundException(cacheKey));
    }
}
