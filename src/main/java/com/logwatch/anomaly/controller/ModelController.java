package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.engine.isolationforest.MultivariateModel;
import com.logwatch.anomaly.repository.MultivariateModelRepository;
import com.logwatch.anomaly.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Per-service Isolation Forest training and metadata")
public class ModelController {

    private final ModelTrainingService trainingService;
    private final MultivariateModelRepository modelRepository;

    public ModelController(ModelTrainingService trainingService,
                           MultivariateModelRepository modelRepository) {
        this.trainingService = trainingService;
        this.modelRepository = modelRepository;
    }

    @Operation(summary = "Train the model for one service",
            description = "Fits an Isolation Forest on the service's feature samples from the trailing baseline window. " +
                    "On failure the previously trained model stays in service.")
    @PostMapping("/train/{service}")
    public ResponseEntity<Map<String, Object>> trainForService(
            @Parameter(description = "Service name", example = "billing-api")
            @PathVariable String service) {
        MultivariateModel model = trainingService.trainService(service);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", model.getService());
        response.put("scoreThreshold", model.getScoreThreshold());
        response.put("trainingSamples", model.getTrainingSamples());
        response.put("trainedAt", model.getTrainedAt());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Train models for all services",
            description = "Returns, per service, 'trained' or the reason it was skipped")
    @PostMapping("/train")
    public ResponseEntity<Map<String, String>> trainAll() {
        return ResponseEntity.ok(trainingService.trainAll());
    }

    @Operation(summary = "Get model metadata",
            description = "Tree count, feature names, score threshold, training samples and training timestamp")
    @GetMapping("/{service}")
    public ResponseEntity<?> getModelMetadata(
            @Parameter(description = "Service name", example = "billing-api")
            @PathVariable String service) {
        return modelRepository.getModelMetadata(service)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
