package alerthub.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 静默规则，sourceType/severity为null表示Any，模式字段为空表示通配
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SilenceRule {
    private String id;
    private String name;
    private AlertSource sourceType;
    private String sourceId;
    private String sourceLabel;
    private String servicePattern;
    private String environmentPattern;
    private String alertNamePattern;
    private String instancePattern;
    private Severity severity;
    private Instant startsAt;
    private Instant endsAt;
    @Builder.Default
    private boolean enabled = true;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isActive(Instant now) {
        return enabled
                && startsAt != null
                && endsAt != null
                && !now.isBefore(startsAt)
                && !now.isAfter(endsAt);
    }
}
