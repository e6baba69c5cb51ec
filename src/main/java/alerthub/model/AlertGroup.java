package alerthub.model;

import lombok.Value;

import java.util.List;

/**
 * 分组结果，每次拉取重新计算，不持久化
 */
@Value
public class AlertGroup {
    Alert representative;
    String groupKey;
    int groupSize;
    List<String> groupedAlertIds;   // 按时间倒序
}
