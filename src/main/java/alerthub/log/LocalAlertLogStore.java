package alerthub.log;

import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class LocalAlertLogStore implements AlertLogStore {
    private static final Comparator<AlertLogEntry> NEWEST_FIRST = Comparator
            .comparing(AlertLogEntry::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(AlertLogEntry::getAlertId);

    private final Map<String, AlertLogEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void record(Collection<AlertLogEntry> newEntries) {
        for (AlertLogEntry entry : newEntries) {
            entries.compute(entry.getAlertId(), (id, existing) -> entry.mergeInto(existing));
        }
    }

    @Override
    public int pruneBefore(Instant cutoff) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.getLastSeenAt().isBefore(cutoff));
        return before - entries.size();
    }

    @Override
    public List<AlertLogEntry> listSince(Instant cutoff) {
        return since(cutoff, null).collect(Collectors.toList());
    }

    @Override
    public long countSince(Instant cutoff, String query) {
        return since(cutoff, query).count();
    }

    @Override
    public List<AlertLogEntry> pageSince(Instant cutoff, String query, int limit, int offset) {
        return since(cutoff, query)
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    private Stream<AlertLogEntry> since(Instant cutoff, String query) {
        return entries.values().stream()
                .filter(entry -> !entry.getLastSeenAt().isBefore(cutoff))
                .filter(matching(query))
                .sorted(NEWEST_FIRST)
                .map(entry -> entry.toBuilder().build());
    }

    private static Predicate<AlertLogEntry> matching(String query) {
        String trimmed = StringUtils.trimToEmpty(query);
        if (trimmed.isEmpty()) {
            return entry -> true;
        }
        return entry -> Stream.of(
                        entry.getTimestamp() != null ? entry.getTimestamp().toString() : null,
                        entry.getName(),
                        entry.getSeverity() != null ? entry.getSeverity().value() : null,
                        entry.getSourceLabel(),
                        entry.getSource() != null ? entry.getSource().getDisplayName() : null,
                        entry.getInstance())
                .anyMatch(value -> StringUtils.containsIgnoreCase(value, trimmed));
    }
}
