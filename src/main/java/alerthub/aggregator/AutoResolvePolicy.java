package alerthub.aggregator;

/**
 * 拉取后自动把消失告警置为resolved的策略
 */
public enum AutoResolvePolicy {
    /** 每次拉取都执行 */
    ALWAYS,
    /** 本次有数据源出错时跳过，避免源不可达导致误恢复 */
    SKIP_ON_ERRORS,
    /** 不自动恢复 */
    DISABLED
}
