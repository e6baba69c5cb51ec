package alerthub.source;

import alerthub.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AlertNormalizer")
class AlertNormalizerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("关键字和数字优先级映射为统一级别")
    void normalizesSeverity() {
        assertThat(AlertNormalizer.normalizeSeverity("Critical")).isEqualTo(Severity.CRITICAL);
        assertThat(AlertNormalizer.normalizeSeverity("HIGH")).isEqualTo(Severity.CRITICAL);
        assertThat(AlertNormalizer.normalizeSeverity("disaster")).isEqualTo(Severity.CRITICAL);
        assertThat(AlertNormalizer.normalizeSeverity("5")).isEqualTo(Severity.CRITICAL);
        assertThat(AlertNormalizer.normalizeSeverity("4")).isEqualTo(Severity.CRITICAL);
        assertThat(AlertNormalizer.normalizeSeverity("warning")).isEqualTo(Severity.WARNING);
        assertThat(AlertNormalizer.normalizeSeverity("average")).isEqualTo(Severity.WARNING);
        assertThat(AlertNormalizer.normalizeSeverity("3")).isEqualTo(Severity.WARNING);
        assertThat(AlertNormalizer.normalizeSeverity("2")).isEqualTo(Severity.WARNING);
        assertThat(AlertNormalizer.normalizeSeverity("1")).isEqualTo(Severity.INFO);
        assertThat(AlertNormalizer.normalizeSeverity("page")).isEqualTo(Severity.INFO);
        assertThat(AlertNormalizer.normalizeSeverity(null)).isEqualTo(Severity.INFO);
    }

    @Test
    void parsesTimestamps() {
        assertThat(AlertNormalizer.parseTimestamp("2024-04-30T08:15:00.123Z", NOW))
                .isEqualTo(Instant.parse("2024-04-30T08:15:00.123Z"));
        assertThat(AlertNormalizer.parseTimestamp("2024-04-30T10:15:00+02:00", NOW))
                .isEqualTo(Instant.parse("2024-04-30T08:15:00Z"));
        assertThat(AlertNormalizer.parseTimestamp("2024-04-30 08:15:00.000", NOW))
                .isEqualTo(Instant.parse("2024-04-30T08:15:00Z"));
        assertThat(AlertNormalizer.parseTimestamp("not a date", NOW)).isEqualTo(NOW);
        assertThat(AlertNormalizer.parseTimestamp(" ", NOW)).isEqualTo(NOW);
    }

    @Test
    void parsesEpochSeconds() {
        assertThat(AlertNormalizer.fromEpochSeconds("1714550400", NOW)).isEqualTo(Instant.parse("2024-05-01T08:00:00Z"));
        assertThat(AlertNormalizer.fromEpochSeconds("0", NOW)).isEqualTo(NOW);
        assertThat(AlertNormalizer.fromEpochSeconds("abc", NOW)).isEqualTo(NOW);
    }

    @Test
    @DisplayName("相同字段得到相同id，空字段不参与拼接")
    void alertIdIsStableAndSkipsEmptyParts() {
        String first = AlertNormalizer.alertId("src", "fp", "name", "-", NOW);
        String second = AlertNormalizer.alertId("src", "fp", "name", "-", NOW);
        assertThat(first).isEqualTo(second).hasSize(40);
        assertThat(AlertNormalizer.alertId("src", null, "", "name"))
                .isEqualTo(AlertNormalizer.alertId("src", "name"));
        assertThat(AlertNormalizer.alertId("src", "a")).isNotEqualTo(AlertNormalizer.alertId("src", "b"));
    }

    @Test
    void appendsPathOnce() {
        assertThat(AlertNormalizer.appendPath("http://am:9093///", "/api/v2/alerts"))
                .isEqualTo("http://am:9093/api/v2/alerts");
        assertThat(AlertNormalizer.appendPath("http://am:9093/api/v2/alerts", "/api/v2/alerts"))
                .isEqualTo("http://am:9093/api/v2/alerts");
    }

    @Test
    void appendsSourceName() {
        assertThat(AlertNormalizer.withSourceName("Disk full", "prod")).isEqualTo("Disk full (prod)");
        assertThat(AlertNormalizer.withSourceName("Disk full", "")).isEqualTo("Disk full");
    }
}
