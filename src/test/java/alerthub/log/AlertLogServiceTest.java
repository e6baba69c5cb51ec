package alerthub.log;

import alerthub.model.Alert;
import alerthub.model.AlertSource;
import alerthub.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AlertLogService")
class AlertLogServiceTest {
    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private final AtomicReference<Instant> now = new AtomicReference<>(T0);
    private LocalAlertLogStore store;
    private AlertLogService service;

    @BeforeEach
    void setUp() {
        store = new LocalAlertLogStore();
        Clock clock = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now.get();
            }
        };
        service = new AlertLogService(store, AlertLogService.DEFAULT_RETENTION, clock);
    }

    private static Alert alert(String id, String name, Instant timestamp) {
        return Alert.builder()
                .id(id)
                .source(AlertSource.METRICS_ALERTING)
                .sourceId("prom")
                .sourceLabel("prod")
                .name(name)
                .severity(Severity.WARNING)
                .message(name + " (prod)")
                .instance("node-1")
                .timestamp(timestamp)
                .build();
    }

    @Test
    @DisplayName("首次出现时间只写一次，最近出现时间每次刷新")
    void keepsFirstSeenAndRefreshesLastSeen() {
        service.record(List.of(alert("a", "HighCPU", T0.minusSeconds(60))));
        now.set(T0.plus(Duration.ofMinutes(5)));
        service.record(List.of(alert("a", "HighCPU renamed", T0.minusSeconds(60))));

        List<AlertLogEntry> entries = service.listSince(T0.minus(Duration.ofDays(1)));

        assertThat(entries).hasSize(1);
        AlertLogEntry entry = entries.get(0);
        assertThat(entry.getFirstSeenAt()).isEqualTo(T0);
        assertThat(entry.getLastSeenAt()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
        assertThat(entry.getName()).isEqualTo("HighCPU renamed");
        assertThat(entry.getSource()).isEqualTo(AlertSource.METRICS_ALERTING);
    }

    @Test
    @DisplayName("超过30天未出现的记录被清理")
    void prunesEntriesOutsideRetention() {
        service.record(List.of(alert("old", "Old", T0)));
        now.set(T0.plus(Duration.ofDays(31)));
        service.record(List.of(alert("new", "New", T0.plus(Duration.ofDays(31)))));

        assertThat(store.listSince(Instant.EPOCH)).extracting(AlertLogEntry::getAlertId).containsExactly("new");
    }

    @Test
    void listsNewestFirstAndFiltersByCutoff() {
        service.record(List.of(alert("a", "A", T0.minusSeconds(30)), alert("b", "B", T0.minusSeconds(10))));
        now.set(T0.plus(Duration.ofHours(2)));
        service.record(List.of(alert("c", "C", T0.minusSeconds(20))));

        assertThat(service.listSince(T0.minus(Duration.ofHours(1))))
                .extracting(AlertLogEntry::getAlertId).containsExactly("b", "c", "a");
        assertThat(service.listSince(T0.plus(Duration.ofHours(1))))
                .extracting(AlertLogEntry::getAlertId).containsExactly("c");
    }

    @Test
    @DisplayName("按关键字分页查询")
    void pagesWithQuery() {
        service.record(List.of(
                alert("a", "Disk full", T0.minusSeconds(3)),
                alert("b", "disk slow", T0.minusSeconds(2)),
                alert("c", "HighCPU", T0.minusSeconds(1))));
        Instant cutoff = T0.minus(Duration.ofDays(1));

        assertThat(service.countSince(cutoff, "  DISK ")).isEqualTo(2);
        assertThat(service.countSince(cutoff, "")).isEqualTo(3);
        assertThat(service.countSince(cutoff, "prometheus")).isEqualTo(3);
        assertThat(service.countSince(cutoff, "warning")).isEqualTo(3);
        assertThat(service.countSince(cutoff, "2024-04-30")).isZero();
        assertThat(service.pageSince(cutoff, "disk", 1, 0))
                .extracting(AlertLogEntry::getAlertId).containsExactly("b");
        assertThat(service.pageSince(cutoff, "disk", 1, 1))
                .extracting(AlertLogEntry::getAlertId).containsExactly("a");
        assertThat(service.pageSince(cutoff, null, 10, 5)).isEmpty();
    }

    @Test
    void emptyPollRecordsNothing() {
        service.record(List.of());

        assertThat(store.countSince(Instant.EPOCH, null)).isZero();
    }
}
