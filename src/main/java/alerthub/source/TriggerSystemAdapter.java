package alerthub.source;

import alerthub.model.Alert;
import alerthub.model.AlertSource;
import alerthub.settings.TriggerSystemSource;
import alerthub.utils.JsonNodes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Zabbix JSON-RPC trigger.get 拉取处于问题状态的触发器
 */
public class TriggerSystemAdapter implements SourceAdapter<TriggerSystemSource> {
    static final String RPC_PATH = "/zabbix/api_jsonrpc.php";

    private static final Map<String, String> PRIORITY_LABELS = Map.of(
            "0", "Not classified",
            "1", "Information",
            "2", "Warning",
            "3", "Average",
            "4", "High",
            "5", "Disaster"
    );

    private final UpstreamHttpClient httpClient;
    private final Clock clock;

    public TriggerSystemAdapter(UpstreamHttpClient httpClient, Clock clock) {
        this.httpClient = httpClient;
        this.clock = clock;
    }

    @Override
    public AlertSource getSourceType() {
        return AlertSource.TRIGGER_SYSTEM;
    }

    @Override
    public Class<TriggerSystemSource> getConfigType() {
        return TriggerSystemSource.class;
    }

    @Override
    public List<Alert> fetch(TriggerSystemSource source) {
        JsonNode result = requestTriggers(source, "description", "priority", "lastchange", "triggerid");
        List<Alert> alerts = new ArrayList<>();
        Instant now = clock.instant();
        for (JsonNode trigger : result) {
            alerts.add(toAlert(source, trigger, now));
        }
        return alerts;
    }

    @Override
    public Optional<String> probe(TriggerSystemSource source) {
        JsonNode result = requestTriggers(source, "description", "priority");
        if (result.isEmpty()) {
            return Optional.empty();
        }
        JsonNode trigger = result.get(0);
        String priority = StringUtils.defaultString(JsonNodes.text(trigger, "priority"));
        return Optional.of(hostOf(trigger)
                + "\t" + StringUtils.defaultIfBlank(JsonNodes.text(trigger, "description"), "-")
                + "\t" + PRIORITY_LABELS.getOrDefault(priority, priority));
    }

    private JsonNode requestTriggers(TriggerSystemSource source, String... output) {
        String url = AlertNormalizer.appendPath(source.getUrl(), RPC_PATH);
        Map<String, String> headers = new HashMap<>();
        headers.put("Accept", "application/json");
        if (StringUtils.isNotEmpty(source.getToken())) {
            headers.put("Authorization", "Bearer " + source.getToken());
        }
        UpstreamResponse response = httpClient.executeForSuccess(
                UpstreamHttpClient.post(url, headers, buildRequestBody(output), UpstreamHttpClient.JSON_RPC));
        JsonNode data = httpClient.readJson(response);

        JsonNode error = data.get("error");
        if (error != null && !error.isNull()) {
            String message = StringUtils.defaultIfBlank(JsonNodes.firstText(error, "data", "message"), "unknown error");
            throw SourceFetchException.rejected("Zabbix API error: " + message);
        }
        JsonNode result = data.get("result");
        return result != null && result.isArray() ? result : httpClient.getObjectMapper().createArrayNode();
    }

    private String buildRequestBody(String... output) {
        ObjectMapper mapper = httpClient.getObjectMapper();
        ObjectNode body = mapper.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("method", "trigger.get");
        ObjectNode params = body.putObject("params");
        params.set("output", mapper.valueToTree(output));
        params.putArray("selectHosts").add("host");
        params.putObject("filter").put("value", 1);
        body.put("id", 1);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("构建JSON-RPC请求失败", e);
        }
    }

    private Alert toAlert(TriggerSystemSource source, JsonNode trigger, Instant now) {
        String host = hostOf(trigger);
        String name = StringUtils.defaultIfBlank(JsonNodes.text(trigger, "description"), "Trigger");
        String triggerId = JsonNodes.text(trigger, "triggerid");
        Instant timestamp = AlertNormalizer.fromEpochSeconds(JsonNodes.text(trigger, "lastchange"), now);

        return Alert.builder()
                .id(AlertNormalizer.alertId(source.getId(), triggerId, host, name, timestamp))
                .source(AlertSource.TRIGGER_SYSTEM)
                .sourceId(source.getId())
                .sourceLabel(source.getName())
                .name(name)
                .severity(AlertNormalizer.normalizeSeverity(JsonNodes.text(trigger, "priority")))
                .message(AlertNormalizer.withSourceName(host + " - " + name, source.getName()))
                .instance(host)
                .fingerprint(triggerId)
                .timestamp(timestamp)
                .build();
    }

    private static String hostOf(JsonNode trigger) {
        return StringUtils.defaultIfBlank(JsonNodes.text(JsonNodes.first(trigger, "hosts"), "host"), "unknown");
    }
}
