package alerthub.source;

import alerthub.model.Alert;
import alerthub.model.AlertSource;
import alerthub.model.Severity;
import alerthub.settings.UptimeCheckSource;
import alerthub.settings.UptimeMode;
import alerthub.utils.JsonNodes;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.Request;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Uptime Kuma 监控状态拉取。
 * 状态页模式并行请求状态页定义和心跳，API Key模式解析 /metrics 文本导出。
 */
public class UptimeCheckAdapter implements SourceAdapter<UptimeCheckSource> {
    private static final Pattern STATUS_PAGE_URL = Pattern.compile("^(https?://.+?)(?:/status-page|/status)/([^/]+)$");
    private static final Pattern MONITOR_STATUS_LINE =
            Pattern.compile("monitor_status\\{[^}]*monitor_name=\"([^\"]+)\"[^}]*}\\s+([0-9.]+)");
    private static final String DOWN_MESSAGE = "Monitor down";

    private final UpstreamHttpClient httpClient;
    private final Clock clock;

    public UptimeCheckAdapter(UpstreamHttpClient httpClient, Clock clock) {
        this.httpClient = httpClient;
        this.clock = clock;
    }

    @Override
    public AlertSource getSourceType() {
        return AlertSource.UPTIME_CHECK;
    }

    @Override
    public Class<UptimeCheckSource> getConfigType() {
        return UptimeCheckSource.class;
    }

    @Override
    public List<Alert> fetch(UptimeCheckSource source) {
        if (source.getMode() == UptimeMode.API_KEY) {
            Instant now = clock.instant();
            return fetchDownMonitorNames(source).stream()
                    .map(name -> downAlert(source, name, now, source.getId(), name))
                    .collect(Collectors.toList());
        }
        return fetchStatusPage(source).stream()
                .map(monitor -> downAlert(source, monitor.name, monitor.downSince, source.getId(), monitor.id, monitor.name))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<String> probe(UptimeCheckSource source) {
        Optional<String> firstDown = source.getMode() == UptimeMode.API_KEY
                ? fetchDownMonitorNames(source).stream().findFirst()
                : fetchStatusPage(source).stream().map(monitor -> monitor.name).findFirst();
        return firstDown.map(name -> "down\t" + name);
    }

    private Alert downAlert(UptimeCheckSource source, String name, Instant timestamp, Object... idParts) {
        return Alert.builder()
                .id(AlertNormalizer.alertId(idParts))
                .source(AlertSource.UPTIME_CHECK)
                .sourceId(source.getId())
                .sourceLabel(source.getName())
                .name(name)
                .severity(Severity.CRITICAL)
                .message(AlertNormalizer.withSourceName(DOWN_MESSAGE, source.getName()))
                .instance(name)
                .timestamp(timestamp)
                .build();
    }

    // ---- 状态页模式 ----

    private List<DownMonitor> fetchStatusPage(UptimeCheckSource source) {
        StatusPageTarget target = resolveStatusTarget(source);
        if (StringUtils.isEmpty(target.slug)) {
            throw SourceFetchException.configInvalid("Status page slug is required");
        }
        String statusUrl = AlertNormalizer.appendPath(target.baseUrl, "/api/status-page/" + target.slug);
        String heartbeatUrl = AlertNormalizer.appendPath(target.baseUrl, "/api/status-page/heartbeat/" + target.slug);
        List<Map<String, String>> attempts = authAttempts(source.getKey(), source.getMode());

        CompletableFuture<JsonNode> statusPage = fetchJson(statusUrl, attempts, 0);
        CompletableFuture<JsonNode> heartbeats = fetchJson(heartbeatUrl, attempts, 0);
        try {
            return statusPage.thenCombine(heartbeats, this::collectDownMonitors).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    private List<DownMonitor> collectDownMonitors(JsonNode statusPage, JsonNode heartbeatPayload) {
        JsonNode heartbeatList = heartbeatPayload.path("heartbeatList");
        Instant now = clock.instant();
        List<DownMonitor> down = new ArrayList<>();
        for (JsonNode monitor : collectMonitors(statusPage)) {
            String id = StringUtils.defaultString(JsonNodes.text(monitor, "id"));
            String name = StringUtils.defaultIfBlank(JsonNodes.text(monitor, "name"), "id=" + id);
            List<JsonNode> beats = sortedByTime(heartbeatList.path(id));
            if (beats.isEmpty() || !isDownStatus(beats.get(beats.size() - 1).get("status"))) {
                continue;
            }
            down.add(new DownMonitor(id, name, downSince(beats, now)));
        }
        return down;
    }

    private static List<JsonNode> collectMonitors(JsonNode statusPage) {
        List<JsonNode> monitors = new ArrayList<>();
        for (JsonNode group : statusPage.path("publicGroupList")) {
            group.path("monitorList").forEach(monitors::add);
        }
        statusPage.path("monitorList").forEach(monitors::add);
        return monitors;
    }

    private static List<JsonNode> sortedByTime(JsonNode heartbeats) {
        List<JsonNode> beats = new ArrayList<>();
        if (heartbeats.isArray()) {
            heartbeats.forEach(beats::add);
        }
        beats.sort(Comparator.comparing(beat -> StringUtils.defaultString(JsonNodes.text(beat, "time"))));
        return beats;
    }

    /**
     * 末尾连续down心跳中最早的一条时间，即本次故障的开始时间
     */
    private static Instant downSince(List<JsonNode> beats, Instant now) {
        String since = null;
        for (int i = beats.size() - 1; i >= 0 && isDownStatus(beats.get(i).get("status")); i--) {
            since = JsonNodes.text(beats.get(i), "time");
        }
        return AlertNormalizer.parseTimestamp(since, now);
    }

    static boolean isDownStatus(JsonNode status) {
        if (status == null || status.isNull()) {
            return false;
        }
        if (status.isBoolean()) {
            return !status.booleanValue();
        }
        if (status.isNumber()) {
            return status.doubleValue() == 0;
        }
        if (status.isTextual()) {
            String value = status.textValue().trim();
            return "down".equalsIgnoreCase(value) || "0".equals(value) || "false".equalsIgnoreCase(value);
        }
        return false;
    }

    static StatusPageTarget resolveStatusTarget(UptimeCheckSource source) {
        String trimmed = StringUtils.stripEnd(StringUtils.trimToEmpty(source.getBaseUrl()), "/");
        Matcher matcher = STATUS_PAGE_URL.matcher(trimmed);
        if (matcher.matches()) {
            return new StatusPageTarget(matcher.group(1),
                    StringUtils.defaultIfBlank(StringUtils.trimToEmpty(source.getSlug()), matcher.group(2)));
        }
        return new StatusPageTarget(trimmed, StringUtils.trimToEmpty(source.getSlug()));
    }

    // ---- API Key 模式 ----

    private List<String> fetchDownMonitorNames(UptimeCheckSource source) {
        String metricsUrl = AlertNormalizer.appendPath(source.getBaseUrl(), "/metrics");
        List<Map<String, String>> attempts = authAttempts(source.getKey(), source.getMode());
        String text;
        try {
            text = fetchText(metricsUrl, attempts, 0).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
        return parseDownMonitors(text);
    }

    /**
     * 同一监控出现多行时以最后一行为准，结果按首次出现顺序去重
     */
    static List<String> parseDownMonitors(String metrics) {
        Map<String, Double> latest = new LinkedHashMap<>();
        for (String line : metrics.split("\\r?\\n")) {
            if (!line.contains("monitor_status{")) {
                continue;
            }
            Matcher matcher = MONITOR_STATUS_LINE.matcher(line);
            if (!matcher.find()) {
                continue;
            }
            try {
                latest.put(matcher.group(1), Double.parseDouble(matcher.group(2)));
            } catch (NumberFormatException e) {
                latest.remove(matcher.group(1));
            }
        }
        return latest.entrySet().stream()
                .filter(entry -> entry.getValue() == 0)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    // ---- 认证重试 ----

    /**
     * 有key时按模式依次尝试 bearer/basic，最后不带认证
     */
    static List<Map<String, String>> authAttempts(String key, UptimeMode mode) {
        List<Map<String, String>> attempts = new ArrayList<>();
        if (StringUtils.isNotEmpty(key)) {
            Map<String, String> basic = Map.of("Authorization", "Basic "
                    + Base64.getEncoder().encodeToString((":" + key).getBytes(StandardCharsets.UTF_8)));
            Map<String, String> bearer = Map.of("Authorization", "Bearer " + key);
            if (mode == UptimeMode.API_KEY) {
                attempts.add(bearer);
                attempts.add(basic);
            } else {
                attempts.add(basic);
                attempts.add(bearer);
            }
        }
        attempts.add(Map.of());
        return attempts;
    }

    private CompletableFuture<JsonNode> fetchJson(String url, List<Map<String, String>> attempts, int index) {
        boolean hasNext = index < attempts.size() - 1;
        return httpClient.executeAsync(request(url, attempts.get(index), "application/json"))
                .thenCompose(response -> {
                    if (isUnauthorized(response) && hasNext) {
                        return fetchJson(url, attempts, index + 1);
                    }
                    if (!response.isSuccessful()) {
                        throw SourceFetchException.rejected(response.getCode());
                    }
                    try {
                        return CompletableFuture.completedFuture(httpClient.readJson(response));
                    } catch (SourceFetchException e) {
                        if (hasNext) {
                            return fetchJson(url, attempts, index + 1);
                        }
                        throw e;
                    }
                });
    }

    private CompletableFuture<String> fetchText(String url, List<Map<String, String>> attempts, int index) {
        boolean hasNext = index < attempts.size() - 1;
        return httpClient.executeAsync(request(url, attempts.get(index), "text/plain"))
                .thenCompose(response -> {
                    if (isUnauthorized(response) && hasNext) {
                        return fetchText(url, attempts, index + 1);
                    }
                    if (!response.isSuccessful()) {
                        throw SourceFetchException.rejected(response.getCode());
                    }
                    if (UpstreamHttpClient.looksLikeHtml(response.getBody())) {
                        if (hasNext) {
                            return fetchText(url, attempts, index + 1);
                        }
                        throw SourceFetchException.malformed("Received HTML response. Check the URL and authentication.");
                    }
                    return CompletableFuture.completedFuture(StringUtils.defaultString(response.getBody()));
                });
    }

    private static Request request(String url, Map<String, String> auth, String accept) {
        Map<String, String> headers = new HashMap<>(auth);
        headers.put("Accept", accept);
        return UpstreamHttpClient.get(url, headers);
    }

    private static boolean isUnauthorized(UpstreamResponse response) {
        return response.getCode() == 401 || response.getCode() == 403;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return SourceFetchException.unreachable("Request failed", cause);
    }

    static final class StatusPageTarget {
        final String baseUrl;
        final String slug;

        StatusPageTarget(String baseUrl, String slug) {
            this.baseUrl = baseUrl;
            this.slug = slug;
        }
    }

    private static final class DownMonitor {
        final String id;
        final String name;
        final Instant downSince;

        DownMonitor(String id, String name, Instant downSince) {
            this.id = id;
            this.name = name;
            this.downSince = downSince;
        }
    }
}
