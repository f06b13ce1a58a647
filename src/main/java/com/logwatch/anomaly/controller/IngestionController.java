package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.model.IngestionStatus;
import com.logwatch.anomaly.service.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/ingestion")
@Tag(name = "Ingestion", description = "Metric source polling state")
public class IngestionController {

    private final IngestionService ingestionService;

    public IngestionController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @GetMapping("/status")
    @Operation(summary = "Get ingestion status",
               description = "Watermark (end of the last processed bucket), last tick outcome and consecutive source failures")
    public ResponseEntity<IngestionStatus> getStatus() {
        return ResponseEntity.ok(ingestionService.getStatus());
    }
}
