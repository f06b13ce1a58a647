package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.model.RuleStats;
import com.logwatch.anomaly.model.RuleType;
import com.logwatch.anomaly.service.RuleFeedbackService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RuleController.class)
class RuleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RuleFeedbackService ruleFeedbackService;

    @Test
    void listRules_success() throws Exception {
        when(ruleFeedbackService.listRules()).thenReturn(List.of(
                stats(RuleType.ERROR_RATE_SPIKE, 0.1, false),
                stats(RuleType.VOLUME_ANOMALY, 0.4, true)));

        mockMvc.perform(get("/api/v1/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].ruleId").value("VOLUME_ANOMALY"))
                .andExpect(jsonPath("$[1].flaggedForReview").value(true))
                .andExpect(jsonPath("$[1].weight").value(0.6));
    }

    @Test
    void getRule_lowerCaseId() throws Exception {
        when(ruleFeedbackService.describe(RuleType.AUTH_FAILURE_BURST))
                .thenReturn(stats(RuleType.AUTH_FAILURE_BURST, 0.0, false));

        mockMvc.perform(get("/api/v1/rules/auth_failure_burst"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.severity").value("CRITICAL"))
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    void getRule_unknown_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/rules/NOT_A_RULE"))
                .andExpect(status().isBadRequest());
    }

    private static RuleStats stats(RuleType ruleType, double ratio, boolean flagged) {
        return RuleStats.builder()
                .ruleId(ruleType.name())
                .name(ruleType.getDisplayName())
                .severity(ruleType.getSeverity())
                .enabled(true)
                .falsePositiveRatio(ratio)
                .weight(1.0 - ratio)
                .flaggedForReview(flagged)
                .build();
    }
}
