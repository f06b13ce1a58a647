package com.logwatch.anomaly.notification;

import com.logwatch.anomaly.config.AlertingConfig;
import com.logwatch.anomaly.model.AnomalyStatus;
import com.logwatch.anomaly.model.RuleType;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static com.logwatch.anomaly.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DashboardSinkTest {

    @Test
    void emit_postsAnnotationWithStatus() {
        AlertingConfig config = new AlertingConfig();
        config.getDashboard().setUrl("http://dash.test/annotations");
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        DashboardSink sink = new DashboardSink(config, builder.build());

        server.expect(requestTo("http://dash.test/annotations"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.status").value("ACKNOWLEDGED"))
                .andRespond(withSuccess());

        sink.emit(stored("A-9", RuleType.GEOGRAPHIC_ANOMALY, "login", T0, AnomalyStatus.ACKNOWLEDGED));

        server.verify();
    }

    @Test
    void emit_dashboardDown_doesNotThrow() {
        AlertingConfig config = new AlertingConfig();
        config.getDashboard().setUrl("http://dash.test/annotations");
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        DashboardSink sink = new DashboardSink(config, builder.build());
        server.expect(requestTo("http://dash.test/annotations")).andRespond(withServerError());

        assertThatCode(() -> sink.emit(stored("A-9", RuleType.GEOGRAPHIC_ANOMALY, "login", T0, AnomalyStatus.NEW)))
                .doesNotThrowAnyException();
    }

    @Test
    void emit_noUrl_logsOnly() {
        DashboardSink sink = new DashboardSink(new AlertingConfig(), RestClient.create());

        assertThatCode(() -> sink.emit(stored("A-9", RuleType.GEOGRAPHIC_ANOMALY, "login", T0, AnomalyStatus.NEW)))
                .doesNotThrowAnyException();
    }
}
