package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.model.RuleStats;
import com.logwatch.anomaly.model.RuleType;
import com.logwatch.anomaly.service.RuleFeedbackService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Detection rules with their false-positive statistics and current weight")
public class RuleController {

    private final RuleFeedbackService ruleFeedbackService;

    public RuleController(RuleFeedbackService ruleFeedbackService) {
        this.ruleFeedbackService = ruleFeedbackService;
    }

    @GetMapping
    @Operation(summary = "List all rules")
    public ResponseEntity<List<RuleStats>> listRules() {
        return ResponseEntity.ok(ruleFeedbackService.listRules());
    }

    @GetMapping("/{ruleId}")
    @Operation(summary = "Get one rule", description = "ruleId is the rule type, e.g. ERROR_RATE_SPIKE")
    public ResponseEntity<RuleStats> getRule(@PathVariable String ruleId) {
        return ResponseEntity.ok(ruleFeedbackService.describe(RuleType.fromId(ruleId)));
    }
}
