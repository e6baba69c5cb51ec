package alerthub.log;

import alerthub.model.Alert;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 每次拉取后写入告警历史，并清理超过保留期的记录
 */
@Slf4j
public class AlertLogService {
    public static final Duration DEFAULT_RETENTION = Duration.ofDays(30);

    private final AlertLogStore store;
    private final Duration retention;
    private final Clock clock;

    public AlertLogService(AlertLogStore store, Duration retention, Clock clock) {
        this.store = store;
        this.retention = retention;
        this.clock = clock;
    }

    public void record(List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        store.record(alerts.stream()
                .map(alert -> AlertLogEntry.from(alert, now))
                .collect(Collectors.toList()));
        int pruned = store.pruneBefore(now.minus(retention));
        if (pruned > 0) {
            log.info("清理过期告警历史: {}条", pruned);
        }
    }

    public List<AlertLogEntry> listSince(Instant cutoff) {
        return store.listSince(cutoff);
    }

    public long countSince(Instant cutoff, String query) {
        return store.countSince(cutoff, query);
    }

    public List<AlertLogEntry> pageSince(Instant cutoff, String query, int limit, int offset) {
        return store.pageSince(cutoff, query, limit, offset);
    }
}
