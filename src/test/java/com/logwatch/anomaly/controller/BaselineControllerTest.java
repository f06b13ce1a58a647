package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.model.Metric;
import com.logwatch.anomaly.service.BaselineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.logwatch.anomaly.testutil.TestDataFactory.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BaselineController.class)
class BaselineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BaselineService baselineService;

    @Test
    void getBaselines_filteredByService() throws Exception {
        when(baselineService.current()).thenReturn(snapshot(
                Map.of("checkout", Set.of("NullPointerException")),
                Map.of("checkout", Set.of("eu-west")),
                baseline("checkout", Metric.REQUEST_COUNT, 100, 10, 40),
                baseline("search", Metric.REQUEST_COUNT, 50, 5, 40)));

        mockMvc.perform(get("/api/v1/baselines").param("service", "checkout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.baselines[0].service").value("checkout"))
                .andExpect(jsonPath("$.knownSignatures[0]").value("NullPointerException"))
                .andExpect(jsonPath("$.knownRegions[0]").value("eu-west"));
    }

    @Test
    void recompute_success() throws Exception {
        when(baselineService.recompute()).thenReturn(Optional.of(snapshot(
                baseline("checkout", Metric.ERROR_RATE, 0.01, 0.002, 40))));

        mockMvc.perform(post("/api/v1/baselines/recompute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.knownSignatures").doesNotExist());
    }

    @Test
    void recompute_alreadyRunning_conflict() throws Exception {
        when(baselineService.recompute()).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/baselines/recompute"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("RECOMPUTE_IN_PROGRESS"));
    }
}
