package alerthub.health;

import alerthub.model.HealthOverview;
import alerthub.model.SourceHealth;
import alerthub.settings.Settings;
import alerthub.settings.SourceConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 按当前设置汇总数据源健康并判断是否陈旧
 */
public class SourceHealthReporter {
    private final SourceHealthTracker tracker;
    private final Duration staleFloor;
    private final Clock clock;

    public SourceHealthReporter(SourceHealthTracker tracker, Duration staleFloor, Clock clock) {
        this.tracker = tracker;
        this.staleFloor = staleFloor;
        this.clock = clock;
    }

    /**
     * max(staleFloor, 3 * refreshInterval)
     */
    public Duration staleThreshold(int refreshIntervalSeconds) {
        Duration byInterval = Duration.ofSeconds(3L * refreshIntervalSeconds);
        return byInterval.compareTo(staleFloor) > 0 ? byInterval : staleFloor;
    }

    public HealthOverview report(Settings settings) {
        Duration threshold = staleThreshold(settings.getRefreshIntervalSeconds());
        Instant now = clock.instant();
        List<HealthOverview.SourceStatus> sources = settings.getConfiguredSources().stream()
                .map(this::statusOf)
                .collect(Collectors.toList());
        List<HealthOverview.SourceStatus> stale = sources.stream()
                .filter(status -> isStale(status, threshold, now))
                .collect(Collectors.toList());
        return HealthOverview.builder()
                .staleThresholdMs(threshold.toMillis())
                .sources(sources)
                .staleSources(stale)
                .build();
    }

    static boolean isStale(HealthOverview.SourceStatus status, Duration threshold, Instant now) {
        if (status.getLastSuccessAt() == null) {
            return status.getFailCount() > 0;
        }
        return Duration.between(status.getLastSuccessAt(), now).compareTo(threshold) > 0;
    }

    private HealthOverview.SourceStatus statusOf(SourceConfig source) {
        SourceHealth health = tracker.getHealth(source.getSourceType(), source.getId())
                .orElseGet(() -> SourceHealth.builder().build());
        return HealthOverview.SourceStatus.builder()
                .sourceId(source.getId())
                .sourceType(source.getSourceType())
                .sourceLabel(source.getName())
                .lastSuccessAt(health.getLastSuccessAt())
                .lastErrorAt(health.getLastErrorAt())
                .lastErrorMessage(health.getLastErrorMessage())
                .failCount(health.getFailCount())
                .nextRetryAt(health.getNextRetryAt())
                .build();
    }
}
