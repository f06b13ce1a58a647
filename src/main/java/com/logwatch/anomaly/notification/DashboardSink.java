package com.logwatch.anomaly.notification;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Receives every stored anomaly and every status change. Posts an annotation to the
 * dashboard when a URL is configured, otherwise writes one structured log line that
 * the log pipeline picks up. Best effort: failures are logged and never block routing.
 */
@Component
public class DashboardSink {

    private static final Logger log = LoggerFactory.getLogger(DashboardSink.class);

    private final String url;
    private final RestClient restClient;

    @Autowired
    public DashboardSink(AlertingConfig config) {
        this(config, RestClient.builder()
                .requestFactory(requestFactory(config.getDashboard().getTimeoutMs()))
                .build());
    }

    DashboardSink(AlertingConfig config, RestClient restClient) {
        this.url = config.getDashboard().getUrl();
        this.restClient = restClient;
    }

    public void emit(Anomaly anomaly) {
        if (url == null || url.isBlank()) {
            log.info("anomaly_event id={} service={} rule={} severity={} status={} score={} detectedAt={}",
                    anomaly.getAnomalyId(), anomaly.getService(), anomaly.getRuleId(),
                    anomaly.getSeverity(), anomaly.getStatus(),
                    String.format("%.4f", anomaly.getScore()), anomaly.getDetectedAt());
            return;
        }

        Map<String, Object> annotation = AlertMessages.payload(anomaly);
        try {
            restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(annotation)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            log.warn("Dashboard annotation failed for anomaly {}: {}", anomaly.getAnomalyId(), e.getMessage());
        }
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return factory;
    }
}
