package alerthub.log;

import alerthub.model.Alert;
import alerthub.model.AlertSource;
import alerthub.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;

/**
 * 告警历史记录，按告警id去重
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertLogEntry {
    private String alertId;
    private AlertSource source;
    private String sourceLabel;
    private String name;
    private Severity severity;
    private String message;
    private Instant timestamp;
    private String instance;
    private Instant firstSeenAt;    // 首次出现，之后不再修改
    private Instant lastSeenAt;     // 最近一次拉取到的时间

    public static AlertLogEntry from(Alert alert, Instant seenAt) {
        return AlertLogEntry.builder()
                .alertId(alert.getId())
                .source(alert.getSource())
                .sourceLabel(StringUtils.defaultString(alert.getSourceLabel()))
                .name(alert.getName())
                .severity(alert.getSeverity())
                .message(alert.getMessage())
                .timestamp(alert.getTimestamp())
                .instance(StringUtils.defaultString(alert.getInstance()))
                .firstSeenAt(seenAt)
                .lastSeenAt(seenAt)
                .build();
    }

    /**
     * 已有记录再次出现时合并，保留首次出现时间和事件时间
     */
    public AlertLogEntry mergeInto(AlertLogEntry existing) {
        if (existing == null) {
            return this;
        }
        return toBuilder()
                .timestamp(existing.getTimestamp() != null ? existing.getTimestamp() : timestamp)
                .firstSeenAt(existing.getFirstSeenAt() != null ? existing.getFirstSeenAt() : firstSeenAt)
                .build();
    }
}
