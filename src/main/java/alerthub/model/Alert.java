package alerthub.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * 归一化后的告警记录，一次拉取内不可变
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Alert {
    String id;                  // 内容哈希，重复拉取同一事件结果不变
    AlertSource source;
    String sourceId;
    String sourceLabel;
    String name;
    Severity severity;
    String message;
    String instance;
    String service;
    String environment;
    String fingerprint;         // 上游提供的稳定去重键
    Instant timestamp;          // 事件开始时间
}
