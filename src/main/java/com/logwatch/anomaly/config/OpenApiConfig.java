package com.logwatch.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI logAnomalyEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Log Anomaly Engine API")
                        .version("1.0.0")
                        .description(
                                "Anomaly detection and alerting sidecar for the log aggregation stack.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Ingester polls request events every analysis interval and builds one feature sample per (service, bucket)\n" +
                                "2. Detector scores each sample against the current baseline snapshot (hour-of-day x day-of-week)\n" +
                                "3. Alert Manager groups candidates, routes by severity and tracks lifecycle\n" +
                                "4. Operator feedback feeds a per-rule false-positive ratio back into the detector\n\n" +
                                "**Rules:**\n" +
                                "- `ERROR_RATE_SPIKE` (critical) - error rate above mean + k sigma\n" +
                                "- `VOLUME_ANOMALY` (warning) - request count above +3 sigma or below -2 sigma\n" +
                                "- `LATENCY_DEGRADATION` (warning) - p95 above 2x baseline mean\n" +
                                "- `AUTH_FAILURE_BURST` (critical) - auth failures from one source within a short window\n" +
                                "- `NOVEL_ERROR_PATTERN` (warning) - error signature never seen during the baseline window\n" +
                                "- `GEOGRAPHIC_ANOMALY` (info, optional) - traffic from a new region\n" +
                                "- `MULTIVARIATE_OUTLIER` (info, optional) - isolation forest over the full feature vector\n\n" +
                                "**Lifecycle:** new -> acknowledged -> resolved, or new|acknowledged -> false_positive")
                        .contact(new Contact().name("Observability Team")));
    }
}
