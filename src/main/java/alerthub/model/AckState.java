package alerthub.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 单条告警的确认状态
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AckState {
    private String alertId;
    private AckStatus status;
    private String note;
    private Instant updatedAt;
    private String updatedBy;
    private Instant acknowledgedAt;
    private Instant resolvedAt;
    private Instant createdAt;
}
