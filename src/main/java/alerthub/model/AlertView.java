package alerthub.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 告警与确认状态合并后的展示记录
 */
@Value
@Builder
public class AlertView {
    Alert alert;
    AckStatus ackStatus;
    String ackNote;
    Instant ackUpdatedAt;
    String ackUpdatedBy;
    Instant acknowledgedAt;
    Instant resolvedAt;

    // 分组信息，未分组时为空
    String groupKey;
    Integer groupSize;
    List<String> groupedAlertIds;
}
