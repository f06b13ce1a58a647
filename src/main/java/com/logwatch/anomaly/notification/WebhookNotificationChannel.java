package com.logwatch.anomaly.notification;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.exception.DeliveryException;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * JSON POST to a configured URL. Takes every routed severity, immediately or as a digest.
 */
@Component
public class WebhookNotificationChannel implements NotificationChannel {

    public static final String NAME = "webhook";

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    private final String url;
    private final RestClient restClient;

    @Autowired
    public WebhookNotificationChannel(AlertingConfig config) {
        this(config, RestClient.builder()
                .requestFactory(requestFactory(config.getWebhook()))
                .build());
    }

    WebhookNotificationChannel(AlertingConfig config, RestClient restClient) {
        this.url = config.getWebhook().getUrl();
        this.restClient = restClient;
        if (isEnabled()) {
            log.info("Webhook channel enabled");
        } else {
            log.info("Webhook channel is DISABLED (no URL configured)");
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return url != null && !url.isBlank();
    }

    @Override
    public boolean accepts(Severity severity) {
        return true;
    }

    @Override
    public boolean acceptsBatches() {
        return true;
    }

    @Override
    public void send(Anomaly anomaly) {
        post(AlertMessages.payload(anomaly));
    }

    @Override
    public void sendBatch(List<Anomaly> anomalies) {
        post(AlertMessages.batchPayload(anomalies));
    }

    private void post(Object body) {
        try {
            restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new DeliveryException(NAME, "Webhook delivery failed: " + e.getMessage(), e);
        }
    }

    private static SimpleClientHttpRequestFactory requestFactory(AlertingConfig.Webhook webhook) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(webhook.getConnectTimeoutMs());
        factory.setReadTimeout(webhook.getReadTimeoutMs());
        return factory;
    }
}
