package alerthub.source;

import alerthub.model.Alert;
import alerthub.model.AlertSource;
import alerthub.settings.AuthType;
import alerthub.settings.MetricsAlertingSource;
import alerthub.utils.JsonNodes;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prometheus Alertmanager v2 告警拉取
 */
public class MetricsAlertingAdapter implements SourceAdapter<MetricsAlertingSource> {
    static final String ALERTS_PATH = "/api/v2/alerts";

    private final UpstreamHttpClient httpClient;
    private final Clock clock;

    public MetricsAlertingAdapter(UpstreamHttpClient httpClient, Clock clock) {
        this.httpClient = httpClient;
        this.clock = clock;
    }

    @Override
    public AlertSource getSourceType() {
        return AlertSource.METRICS_ALERTING;
    }

    @Override
    public Class<MetricsAlertingSource> getConfigType() {
        return MetricsAlertingSource.class;
    }

    @Override
    public List<Alert> fetch(MetricsAlertingSource source) {
        JsonNode data = requestAlerts(source);
        List<Alert> alerts = new ArrayList<>();
        if (!data.isArray()) {
            return alerts;
        }
        Instant now = clock.instant();
        for (JsonNode item : data) {
            if (isActive(item)) {
                alerts.add(toAlert(source, item, now));
            }
        }
        return alerts;
    }

    @Override
    public Optional<String> probe(MetricsAlertingSource source) {
        JsonNode data = requestAlerts(source);
        if (!data.isArray()) {
            return Optional.empty();
        }
        for (JsonNode item : data) {
            if (isActive(item)) {
                JsonNode labels = item.path("labels");
                return Optional.of(StringUtils.defaultString(JsonNodes.text(item, "startsAt"))
                        + "\t" + StringUtils.defaultIfBlank(JsonNodes.text(labels, "alertname"), "-")
                        + "\t" + StringUtils.defaultIfBlank(JsonNodes.text(labels, "instance"), "-"));
            }
        }
        return Optional.empty();
    }

    private JsonNode requestAlerts(MetricsAlertingSource source) {
        String url = AlertNormalizer.appendPath(source.getUrl(), ALERTS_PATH);
        Map<String, String> headers = new HashMap<>();
        headers.put("Accept", "application/json");
        headers.putAll(authHeader(source.getAuthType(), source.getAuthValue()));
        UpstreamResponse response = httpClient.executeForSuccess(UpstreamHttpClient.get(url, headers));
        return httpClient.readJson(response);
    }

    private static boolean isActive(JsonNode item) {
        return "active".equals(JsonNodes.text(item.path("status"), "state"));
    }

    private Alert toAlert(MetricsAlertingSource source, JsonNode item, Instant now) {
        JsonNode labels = item.path("labels");
        JsonNode annotations = item.path("annotations");
        String name = StringUtils.defaultIfBlank(JsonNodes.text(labels, "alertname"), "Alert");
        String instance = JsonNodes.text(labels, "instance");
        String instanceLabel = StringUtils.defaultIfBlank(instance, "-");
        String summary = JsonNodes.firstText(annotations, "summary", "description");
        String fingerprint = JsonNodes.text(item, "fingerprint");
        Instant timestamp = AlertNormalizer.parseTimestamp(JsonNodes.text(item, "startsAt"), now);

        return Alert.builder()
                .id(AlertNormalizer.alertId(source.getId(), fingerprint, name, instanceLabel, timestamp))
                .source(AlertSource.METRICS_ALERTING)
                .sourceId(source.getId())
                .sourceLabel(source.getName())
                .name(name)
                .severity(AlertNormalizer.normalizeSeverity(JsonNodes.text(labels, "severity")))
                .message(AlertNormalizer.withSourceName(StringUtils.defaultIfBlank(summary, instanceLabel), source.getName()))
                .instance(StringUtils.defaultString(instance))
                .service(JsonNodes.firstText(labels, "service", "job"))
                .environment(JsonNodes.firstText(labels, "environment", "env"))
                .fingerprint(fingerprint)
                .timestamp(timestamp)
                .build();
    }

    static Map<String, String> authHeader(AuthType type, String value) {
        if (StringUtils.isEmpty(value) || type == null) {
            return Map.of();
        }
        switch (type) {
            case BASIC:
                return Map.of("Authorization", "Basic "
                        + Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8)));
            case BEARER:
                return Map.of("Authorization", "Bearer " + value);
            default:
                return Map.of();
        }
    }
}
