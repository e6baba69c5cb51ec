package alerthub.health;

import alerthub.model.AlertSource;
import alerthub.model.SourceHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 数据源成功/失败记账及退避判断
 */
public class SourceHealthTracker {
    private static final Logger logger = LoggerFactory.getLogger(SourceHealthTracker.class);

    private final SourceHealthStore store;
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;

    public SourceHealthTracker(SourceHealthStore store, BackoffPolicy backoffPolicy, Clock clock) {
        this.store = store;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
    }

    public SourceHealth recordSuccess(AlertSource sourceType, String sourceId) {
        Instant now = clock.instant();
        return store.update(sourceType, sourceId, health -> {
            health.setLastSuccessAt(now);
            health.setLastErrorAt(null);
            health.setLastErrorMessage(null);
            health.setFailCount(0);
            health.setNextRetryAt(null);
            return health;
        });
    }

    public SourceHealth recordFailure(AlertSource sourceType, String sourceId, String message) {
        Instant now = clock.instant();
        SourceHealth updated = store.update(sourceType, sourceId, health -> {
            int failCount = health.getFailCount() + 1;
            health.setFailCount(failCount);
            health.setLastErrorAt(now);
            health.setLastErrorMessage(message);
            health.setNextRetryAt(now.plus(backoffPolicy.delayFor(failCount)));
            return health;
        });
        logger.warn("数据源拉取失败: {}:{}, 连续失败{}次, 下次重试 {}",
                sourceType.getDisplayName(), sourceId, updated.getFailCount(), updated.getNextRetryAt());
        return updated;
    }

    public boolean isInBackoff(AlertSource sourceType, String sourceId) {
        return backoffUntil(sourceType, sourceId).isPresent();
    }

    /**
     * 退避截止时间，已过期或未设置时为空
     */
    public Optional<Instant> backoffUntil(AlertSource sourceType, String sourceId) {
        Instant now = clock.instant();
        return store.find(sourceType, sourceId)
                .map(SourceHealth::getNextRetryAt)
                .filter(nextRetryAt -> nextRetryAt.isAfter(now));
    }

    public Optional<SourceHealth> getHealth(AlertSource sourceType, String sourceId) {
        return store.find(sourceType, sourceId);
    }

    public List<SourceHealth> listHealth() {
        return store.findAll();
    }
}
