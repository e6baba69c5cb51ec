package alerthub.log;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * 告警历史存储；cutoff都按 lastSeenAt 比较，结果按事件时间倒序
 */
public interface AlertLogStore {

    void record(Collection<AlertLogEntry> entries);

    int pruneBefore(Instant cutoff);

    List<AlertLogEntry> listSince(Instant cutoff);

    /**
     * query为空时统计全部，否则对 timestamp/name/severity/sourceLabel/source/instance 做不区分大小写的包含匹配
     */
    long countSince(Instant cutoff, String query);

    List<AlertLogEntry> pageSince(Instant cutoff, String query, int limit, int offset);
}
