package alerthub.source;

import alerthub.model.Alert;
import alerthub.model.Severity;
import alerthub.settings.UptimeCheckSource;
import alerthub.settings.UptimeMode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UptimeCheckAdapter")
class UptimeCheckAdapterTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String STATUS_PAGE = "{\"publicGroupList\":[{\"name\":\"Services\",\"monitorList\":["
            + "{\"id\":1,\"name\":\"API\"},{\"id\":2,\"name\":\"Web\"}]}],"
            + "\"monitorList\":[{\"id\":3,\"name\":\"DNS\"}]}";
    private static final String HEARTBEATS = "{\"heartbeatList\":{"
            + "\"1\":[{\"status\":1,\"time\":\"2024-05-01 10:00:00.000\"},"
            + "{\"status\":0,\"time\":\"2024-05-01 11:00:00.000\"},"
            + "{\"status\":0,\"time\":\"2024-05-01 11:01:00.000\"}],"
            + "\"2\":[{\"status\":0,\"time\":\"2024-05-01 09:00:00.000\"},"
            + "{\"status\":1,\"time\":\"2024-05-01 09:30:00.000\"}],"
            + "\"3\":[{\"status\":\"down\",\"time\":\"2024-05-01 11:30:00.000\"}]"
            + "}}";

    private MockWebServer server;
    private UptimeCheckAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        UpstreamHttpClient httpClient = new UpstreamHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(5));
        adapter = new UptimeCheckAdapter(httpClient, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private UptimeCheckSource statusSource(String baseUrl, String slug) {
        UptimeCheckSource source = new UptimeCheckSource();
        source.setId("kuma-1");
        source.setName("public");
        source.setBaseUrl(baseUrl);
        source.setSlug(slug);
        source.setMode(UptimeMode.STATUS);
        return source;
    }

    private void serveStatusPage(String slug) {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if (("/api/status-page/" + slug).equals(request.getPath())) {
                    return new MockResponse().setHeader("Content-Type", "application/json").setBody(STATUS_PAGE);
                }
                if (("/api/status-page/heartbeat/" + slug).equals(request.getPath())) {
                    return new MockResponse().setHeader("Content-Type", "application/json").setBody(HEARTBEATS);
                }
                return new MockResponse().setResponseCode(404);
            }
        });
    }

    @Test
    @DisplayName("状态页模式：最新心跳为down的监控产生告警，时间取本次故障开始")
    void detectsDownMonitorsFromStatusPage() {
        serveStatusPage("main");
        String baseUrl = server.url("/status/main").toString();

        List<Alert> alerts = adapter.fetch(statusSource(baseUrl, ""));

        assertThat(alerts).extracting(Alert::getName).containsExactly("API", "DNS");
        Alert api = alerts.get(0);
        assertThat(api.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(api.getMessage()).isEqualTo("Monitor down (public)");
        assertThat(api.getInstance()).isEqualTo("API");
        assertThat(api.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T11:00:00Z"));
        assertThat(api.getId()).isEqualTo(AlertNormalizer.alertId("kuma-1", "1", "API"));
        assertThat(alerts.get(1).getTimestamp()).isEqualTo(Instant.parse("2024-05-01T11:30:00Z"));
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void usesConfiguredSlugWithPlainBaseUrl() {
        serveStatusPage("ops");

        List<Alert> alerts = adapter.fetch(statusSource(server.url("/").toString(), "ops"));

        assertThat(alerts).hasSize(2);
    }

    @Test
    void statusModeRequiresSlug() {
        assertThatThrownBy(() -> adapter.fetch(statusSource(server.url("/").toString(), "")))
                .isInstanceOf(SourceFetchException.class)
                .hasMessage("Status page slug is required")
                .extracting(e -> ((SourceFetchException) e).getKind())
                .isEqualTo(SourceFetchException.ErrorKind.CONFIG_INVALID);
    }

    @Test
    @DisplayName("任一子请求失败则整个数据源失败")
    void failsWhenHeartbeatRequestFails() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("/api/status-page/main".equals(request.getPath())) {
                    return new MockResponse().setHeader("Content-Type", "application/json").setBody(STATUS_PAGE);
                }
                return new MockResponse().setResponseCode(502);
            }
        });

        assertThatThrownBy(() -> adapter.fetch(statusSource(server.url("/status/main").toString(), "")))
                .isInstanceOf(SourceFetchException.class)
                .hasMessage("Request failed with 502");
    }

    @Test
    @DisplayName("API Key模式：认证失败时换下一种认证头")
    void apiKeyModeRetriesAuthHeaders() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(401));
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/plain").setBody(
                "# HELP monitor_status Monitor Status\n"
                        + "monitor_status{monitor_name=\"API\",monitor_type=\"http\"} 1\n"
                        + "monitor_status{monitor_name=\"DB\",monitor_type=\"port\"} 0\n"
                        + "monitor_status{monitor_name=\"API\",monitor_type=\"http\"} 0\n"));
        UptimeCheckSource source = statusSource(server.url("/").toString(), "");
        source.setMode(UptimeMode.API_KEY);
        source.setKey("k1");

        List<Alert> alerts = adapter.fetch(source);

        assertThat(alerts).extracting(Alert::getName).containsExactly("API", "DB");
        assertThat(alerts.get(0).getTimestamp()).isEqualTo(NOW);
        assertThat(alerts.get(0).getId()).isEqualTo(AlertNormalizer.alertId("kuma-1", "API"));
        assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("Bearer k1");
        RecordedRequest second = server.takeRequest();
        assertThat(second.getPath()).isEqualTo("/metrics");
        assertThat(second.getHeader("Authorization")).startsWith("Basic ");
    }

    @Test
    void apiKeyModeReportsHtmlAfterAllAttempts() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setHeader("Content-Type", "text/html").setBody("<html>login</html>"));
        }
        UptimeCheckSource source = statusSource(server.url("/").toString(), "");
        source.setMode(UptimeMode.API_KEY);
        source.setKey("k1");

        assertThatThrownBy(() -> adapter.fetch(source))
                .isInstanceOf(SourceFetchException.class)
                .hasMessage("Received HTML response. Check the URL and authentication.");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void probeReportsFirstDownMonitor() {
        serveStatusPage("main");

        assertThat(adapter.probe(statusSource(server.url("/status-page/main").toString(), "")))
                .contains("down\tAPI");
    }

    @Test
    void parsesDownMonitorsFromMetrics() {
        String metrics = "monitor_status{monitor_name=\"A\"} 0\n"
                + "monitor_status{monitor_name=\"B\"} 1\n"
                + "monitor_response_time{monitor_name=\"A\"} 12\n"
                + "monitor_status{monitor_name=\"C\"} 0\r\n";

        assertThat(UptimeCheckAdapter.parseDownMonitors(metrics)).containsExactly("A", "C");
    }

    @Test
    void authAttemptOrderDependsOnMode() {
        List<Map<String, String>> status = UptimeCheckAdapter.authAttempts("k", UptimeMode.STATUS);
        List<Map<String, String>> apiKey = UptimeCheckAdapter.authAttempts("k", UptimeMode.API_KEY);

        assertThat(status).hasSize(3);
        assertThat(status.get(0).get("Authorization")).startsWith("Basic ");
        assertThat(status.get(1).get("Authorization")).isEqualTo("Bearer k");
        assertThat(status.get(2)).isEmpty();
        assertThat(apiKey.get(0).get("Authorization")).isEqualTo("Bearer k");
        assertThat(UptimeCheckAdapter.authAttempts("", UptimeMode.STATUS)).containsExactly(Map.of());
    }

    @Test
    void recognizesDownStatusValues() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        assertThat(UptimeCheckAdapter.isDownStatus(nodes.numberNode(0))).isTrue();
        assertThat(UptimeCheckAdapter.isDownStatus(nodes.booleanNode(false))).isTrue();
        assertThat(UptimeCheckAdapter.isDownStatus(nodes.textNode("DOWN"))).isTrue();
        assertThat(UptimeCheckAdapter.isDownStatus(nodes.textNode("0"))).isTrue();
        assertThat(UptimeCheckAdapter.isDownStatus(nodes.numberNode(1))).isFalse();
        assertThat(UptimeCheckAdapter.isDownStatus(nodes.numberNode(2))).isFalse();
        assertThat(UptimeCheckAdapter.isDownStatus(nodes.textNode("up"))).isFalse();
        assertThat(UptimeCheckAdapter.isDownStatus(null)).isFalse();
    }

    @Test
    void derivesSlugFromStatusUrl() {
        UptimeCheckAdapter.StatusPageTarget target =
                UptimeCheckAdapter.resolveStatusTarget(statusSource("https://kuma.local/status-page/prod/", ""));

        assertThat(target.baseUrl).isEqualTo("https://kuma.local");
        assertThat(target.slug).isEqualTo("prod");
    }
}
