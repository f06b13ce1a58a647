package com.logwatch.anomaly.controller;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.config.EngineConfig;
import com.logwatch.anomaly.config.TwilioNotificationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EngineConfig engineConfig;

    @MockBean
    private AlertingConfig alertingConfig;

    @MockBean
    private TwilioNotificationConfig twilioConfig;

    private AlertingConfig.Webhook webhook;

    @BeforeEach
    void setUp() {
        webhook = new AlertingConfig.Webhook();
        when(engineConfig.getAnalysisIntervalSeconds()).thenReturn(60);
        when(engineConfig.getBaseline()).thenReturn(new EngineConfig.Baseline());
        when(engineConfig.getDetection()).thenReturn(new EngineConfig.Detection());
        when(alertingConfig.getWebhook()).thenReturn(webhook);
        when(alertingConfig.getDashboard()).thenReturn(new AlertingConfig.Dashboard());
        when(alertingConfig.getFalsePositiveRatioThreshold()).thenReturn(0.3);
    }

    @Test
    void getConfig_effectiveValues() throws Exception {
        mockMvc.perform(get("/api/v1/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.engine.analysisIntervalSeconds").value(60))
                .andExpect(jsonPath("$.engine.baseline.windowDays").value(7))
                .andExpect(jsonPath("$.engine.detection.sigmaThreshold").value(3.0))
                .andExpect(jsonPath("$.alerting.falsePositiveRatioThreshold").value(0.3))
                .andExpect(jsonPath("$.alerting.webhookConfigured").value(false))
                .andExpect(jsonPath("$.alerting.smsEnabled").value(false));
    }

    @Test
    void getConfig_neverLeaksSecrets() throws Exception {
        webhook.setUrl("https://hooks.example.com/T000/secret-token");
        when(engineConfig.getIpHashSalt()).thenReturn("pepper");
        when(twilioConfig.getAuthToken()).thenReturn("twilio-secret");
        when(twilioConfig.isConfigured()).thenReturn(true);

        mockMvc.perform(get("/api/v1/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alerting.webhookConfigured").value(true))
                .andExpect(jsonPath("$.alerting.smsEnabled").value(true))
                .andExpect(jsonPath("$.engine.ipHashSalt").doesNotExist())
                .andExpect(content().string(not(containsString("twilio-secret"))))
                .andExpect(content().string(not(containsString("secret-token"))));
    }
}
