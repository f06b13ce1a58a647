package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.engine.isolationforest.MultivariateModel;
import com.logwatch.anomaly.exception.ModelTrainingException;
import com.logwatch.anomaly.repository.MultivariateModelRepository;
import com.logwatch.anomaly.service.ModelTrainingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelTrainingService trainingService;

    @MockBean
    private MultivariateModelRepository modelRepository;

    @Test
    void trainForService_success() throws Exception {
        MultivariateModel model = MultivariateModel.builder()
                .service("billing-api")
                .scoreThreshold(0.62)
                .trainingSamples(1440)
                .trainedAt(1739887200000L)
                .build();
        when(trainingService.trainService("billing-api")).thenReturn(model);

        mockMvc.perform(post("/api/v1/models/train/billing-api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("billing-api"))
                .andExpect(jsonPath("$.scoreThreshold").value(0.62))
                .andExpect(jsonPath("$.trainingSamples").value(1440));
    }

    @Test
    void trainForService_tooLittleHistory_unprocessable() throws Exception {
        when(trainingService.trainService("new-svc"))
                .thenThrow(new ModelTrainingException("insufficient history for new-svc: 3 samples, need 100"));

        mockMvc.perform(post("/api/v1/models/train/new-svc"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("TRAINING_FAILED"));
    }

    @Test
    void trainAll_reportsPerService() throws Exception {
        Map<String, String> outcomes = new LinkedHashMap<>();
        outcomes.put("billing-api", "trained");
        outcomes.put("new-svc", "insufficient history for new-svc: 3 samples, need 100");
        when(trainingService.trainAll()).thenReturn(outcomes);

        mockMvc.perform(post("/api/v1/models/train"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['billing-api']").value("trained"));
    }

    @Test
    void getModelMetadata_found() throws Exception {
        when(modelRepository.getModelMetadata("billing-api"))
                .thenReturn(Optional.of(Map.of("service", "billing-api", "treeCount", 100)));

        mockMvc.perform(get("/api/v1/models/billing-api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.treeCount").value(100));
    }

    @Test
    void getModelMetadata_notFound() throws Exception {
        when(modelRepository.getModelMetadata("unknown")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/models/unknown"))
                .andExpect(status().isNotFound());
    }
}
