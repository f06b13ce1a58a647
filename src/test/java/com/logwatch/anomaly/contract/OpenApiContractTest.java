package com.logwatch.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.logwatch.anomaly.config.TestAerospikeConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published API: every endpoint and the anomaly schemas that
 * dashboards and chat integrations read.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        // Anomaly lifecycle
        assertThat(paths).containsKey("/api/v1/anomalies");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/acknowledge");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/resolve");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/false-positive");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/feedback");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/alerts");

        // Baselines and rules
        assertThat(paths).containsKey("/api/v1/baselines");
        assertThat(paths).containsKey("/api/v1/baselines/recompute");
        assertThat(paths).containsKey("/api/v1/rules");
        assertThat(paths).containsKey("/api/v1/rules/{ruleId}");

        // Models
        assertThat(paths).containsKey("/api/v1/models/train/{service}");
        assertThat(paths).containsKey("/api/v1/models/train");
        assertThat(paths).containsKey("/api/v1/models/{service}");

        // Operations
        assertThat(paths).containsKey("/api/v1/health");
        assertThat(paths).containsKey("/api/v1/ingestion/status");
        assertThat(paths).containsKey("/api/v1/config");
    }

    @Test
    void openApiSpec_anomalySchema_hasLifecycleFields() {
        DocumentContext json = apiDocs();
        Map<String, Object> schemas = json.read("$.components.schemas");
        assertThat(schemas).containsKeys("Anomaly", "Alert", "Feedback", "RuleStats", "IngestionStatus");

        Map<String, Object> anomalyProps = json.read("$.components.schemas.Anomaly.properties");
        assertThat(anomalyProps).containsKeys("anomalyId", "ruleId", "service", "severity", "score",
                "detectedAt", "status", "metadata");
        assertThat(anomalyProps).doesNotContainKey("generation");
    }

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        return JsonPath.parse(response.getBody());
    }
}
