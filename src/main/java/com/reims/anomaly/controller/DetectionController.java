package com.reims.anomaly.controller;

import com.reims.anomaly.dto.EvaluationRequest;
import com.reims.anomaly.engine.DetectionContext;
import com.reims.anomaly.model.EvaluationReport;
import com.reims.anomaly.service.SeriesEvaluationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Run the anomaly detection ensemble over a series")
public class DetectionController {

    private final SeriesEvaluationService evaluationService;

    public DetectionController(SeriesEvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    @Operation(summary = "Evaluate a series",
            description = "Runs every statistical and model-based detector over the series, combines their " +
                    "findings into consensus anomalies, scores their financial impact and applies noise suppression. " +
                    "A series too short for every detector returns success=false with a reason.")
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationReport> evaluate(@Valid @RequestBody EvaluationRequest request) {
        DetectionContext context = DetectionContext.builder()
                .entityId(request.getEntityId())
                .useSeasonality(request.isUseSeasonality())
                .useModelCache(request.isUseModelCache())
                .build();
        return ResponseEntity.ok(evaluationService.evaluate(request.toSeries(), request.getImpactContext(), context));
    }
}
