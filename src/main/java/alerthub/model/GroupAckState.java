package alerthub.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 分组维度合并后的确认状态
 */
@Value
@Builder
public class GroupAckState {
    AckStatus status;
    String note;
    Instant updatedAt;
    String updatedBy;
    Instant acknowledgedAt;
    Instant resolvedAt;

    public static GroupAckState active() {
        return GroupAckState.builder().status(AckStatus.ACTIVE).note("").build();
    }
}
