package com.logwatch.anomaly.notification;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.exception.DeliveryException;
import com.logwatch.anomaly.model.Anomaly;
import com.logwatch.anomaly.model.AnomalyStatus;
import com.logwatch.anomaly.model.RuleType;
import com.logwatch.anomaly.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static com.logwatch.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookNotificationChannelTest {

    private static final String URL = "http://hooks.test/alerts";

    private MockRestServiceServer server;
    private WebhookNotificationChannel channel;

    @BeforeEach
    void setUp() {
        AlertingConfig config = new AlertingConfig();
        config.getWebhook().setUrl(URL);
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        channel = new WebhookNotificationChannel(config, builder.build());
    }

    @Test
    void send_postsAnomalyJson() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.anomalyId").value("A-1"))
                .andExpect(jsonPath("$.ruleId").value("ERROR_RATE_SPIKE"))
                .andExpect(jsonPath("$.severity").value("CRITICAL"))
                .andRespond(withSuccess());

        channel.send(stored("A-1", RuleType.ERROR_RATE_SPIKE, "checkout", T0, AnomalyStatus.NEW));

        server.verify();
    }

    @Test
    void sendBatch_postsOneDigest() {
        List<Anomaly> anomalies = List.of(
                stored("A-1", RuleType.VOLUME_ANOMALY, "checkout", T0, AnomalyStatus.NEW),
                stored("A-2", RuleType.LATENCY_DEGRADATION, "search", T0, AnomalyStatus.NEW));
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.type").value("batch"))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.anomalies[1].anomalyId").value("A-2"))
                .andRespond(withSuccess());

        channel.sendBatch(anomalies);

        server.verify();
    }

    @Test
    void send_serverError_raisesDeliveryException() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> channel.send(stored("A-1", RuleType.ERROR_RATE_SPIKE, "checkout", T0, AnomalyStatus.NEW)))
                .isInstanceOf(DeliveryException.class)
                .extracting(e -> ((DeliveryException) e).getChannel())
                .isEqualTo(WebhookNotificationChannel.NAME);
    }

    @Test
    void noUrl_disabledButAcceptsEverySeverity() {
        WebhookNotificationChannel unconfigured = new WebhookNotificationChannel(new AlertingConfig(), RestClient.create());

        assertThat(unconfigured.isEnabled()).isFalse();
        assertThat(channel.isEnabled()).isTrue();
        assertThat(channel.accepts(Severity.INFO)).isTrue();
        assertThat(channel.acceptsBatches()).isTrue();
    }
}
