package alerthub.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 已配置数据源的健康概览
 */
@Value
@Builder
public class HealthOverview {
    long staleThresholdMs;
    List<SourceStatus> sources;
    List<SourceStatus> staleSources;

    @Value
    @Builder
    public static class SourceStatus {
        String sourceId;
        AlertSource sourceType;
        String sourceLabel;
        Instant lastSuccessAt;
        Instant lastErrorAt;
        String lastErrorMessage;
        int failCount;
        Instant nextRetryAt;
    }
}
