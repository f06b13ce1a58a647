package com.logwatch.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logwatch.anomaly.exception.AnomalyNotFoundException;
import com.logwatch.anomaly.exception.InvalidTransitionException;
import com.logwatch.anomaly.model.*;
import com.logwatch.anomaly.service.AlertManagerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.logwatch.anomaly.testutil.TestDataFactory.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnomalyController.class)
class AnomalyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AlertManagerService alertManagerService;

    @Test
    void listAnomalies_passesFiltersAndReturnsPage() throws Exception {
        Anomaly anomaly = stored("A-1", RuleType.ERROR_RATE_SPIKE, "checkout", T0, AnomalyStatus.NEW);
        when(alertManagerService.search(eq(T0), isNull(), eq("checkout"), eq(AnomalyStatus.NEW),
                eq(Severity.CRITICAL), isNull(), eq(50), isNull()))
                .thenReturn(new PagedResponse<>(List.of(anomaly), true, "1739887200000"));

        mockMvc.perform(get("/api/v1/anomalies")
                        .param("from", String.valueOf(T0))
                        .param("service", "checkout")
                        .param("status", "NEW")
                        .param("severity", "CRITICAL")
                        .param("limit", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].anomalyId").value("A-1"))
                .andExpect(jsonPath("$.data[0].severity").value("CRITICAL"))
                .andExpect(jsonPath("$.data[0].generation").doesNotExist())
                .andExpect(jsonPath("$.hasMore").value(true))
                .andExpect(jsonPath("$.nextCursor").value("1739887200000"));
    }

    @Test
    void listAnomalies_limitOutOfRange_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies").param("limit", "5000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
        verifyNoInteractions(alertManagerService);
    }

    @Test
    void listAnomalies_unknownStatus_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/anomalies").param("status", "SNOOZED"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getAnomaly_missing_notFound() throws Exception {
        when(alertManagerService.getAnomaly("MISSING")).thenThrow(new AnomalyNotFoundException("MISSING"));

        mockMvc.perform(get("/api/v1/anomalies/MISSING"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void acknowledge_withActor() throws Exception {
        Anomaly acked = stored("A-1", RuleType.VOLUME_ANOMALY, "checkout", T0, AnomalyStatus.ACKNOWLEDGED);
        acked.setAcknowledgedBy("alice");
        when(alertManagerService.acknowledge("A-1", "alice", "looking")).thenReturn(acked);

        mockMvc.perform(post("/api/v1/anomalies/A-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("actor", "alice", "note", "looking"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACKNOWLEDGED"))
                .andExpect(jsonPath("$.acknowledgedBy").value("alice"));
    }

    @Test
    void resolve_withoutBody_defaultActor() throws Exception {
        when(alertManagerService.resolve("A-1", "ops", null))
                .thenReturn(stored("A-1", RuleType.VOLUME_ANOMALY, "checkout", T0, AnomalyStatus.RESOLVED));

        mockMvc.perform(post("/api/v1/anomalies/A-1/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"));
        verify(alertManagerService).resolve("A-1", "ops", null);
    }

    @Test
    void resolve_fromNew_conflict() throws Exception {
        when(alertManagerService.resolve(eq("A-1"), any(), any()))
                .thenThrow(new InvalidTransitionException("A-1", AnomalyStatus.NEW, AnomalyStatus.RESOLVED));

        mockMvc.perform(post("/api/v1/anomalies/A-1/resolve"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
    }

    @Test
    void submitFeedback_recorded_created() throws Exception {
        Feedback feedback = feedback("A-1", RuleType.LATENCY_DEGRADATION, FeedbackType.CONFIRMED);
        when(alertManagerService.submitFeedback("A-1", FeedbackType.CONFIRMED, "bob", null))
                .thenReturn(Optional.of(feedback));

        mockMvc.perform(post("/api/v1/anomalies/A-1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"confirmed\",\"actor\":\"bob\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.type").value("CONFIRMED"))
                .andExpect(jsonPath("$.ruleId").value("LATENCY_DEGRADATION"));
    }

    @Test
    void submitFeedback_alreadyDismissed_notRecorded() throws Exception {
        when(alertManagerService.submitFeedback(eq("A-1"), eq(FeedbackType.FALSE_POSITIVE), any(), any()))
                .thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/anomalies/A-1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"FALSE_POSITIVE\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recorded").value(false));
    }

    @Test
    void submitFeedback_missingType_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/anomalies/A-1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"bob\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("type is required"));
    }

    @Test
    void submitFeedback_unknownType_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/anomalies/A-1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"MAYBE\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getAlerts_success() throws Exception {
        when(alertManagerService.alertsFor("A-1"))
                .thenReturn(List.of(pendingAlert("AL-1", "A-1", "webhook", Severity.WARNING)));

        mockMvc.perform(get("/api/v1/anomalies/A-1/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].alertId").value("AL-1"))
                .andExpect(jsonPath("$[0].status").value("PENDING"));
    }
}
