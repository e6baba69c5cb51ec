package alerthub.health;

import alerthub.model.AlertSource;
import alerthub.model.HealthOverview;
import alerthub.settings.MetricsAlertingSource;
import alerthub.settings.Settings;
import alerthub.settings.TriggerSystemSource;
import alerthub.settings.UptimeCheckSource;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceHealthReporterTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void staleThresholdHasFloor() {
        SourceHealthReporter reporter = new SourceHealthReporter(null, Duration.ofMinutes(5), Clock.systemUTC());

        assertThat(reporter.staleThreshold(30)).isEqualTo(Duration.ofMinutes(5));
        assertThat(reporter.staleThreshold(600)).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void reportsConfiguredSourcesAndStaleOnes() {
        LocalSourceHealthStore store = new LocalSourceHealthStore();
        SourceHealthTracker tracker = new SourceHealthTracker(store, BackoffPolicy.defaults(),
                Clock.fixed(NOW.minus(Duration.ofMinutes(10)), ZoneOffset.UTC));
        tracker.recordSuccess(AlertSource.METRICS_ALERTING, "old");
        tracker.recordFailure(AlertSource.TRIGGER_SYSTEM, "never", "boom");

        MetricsAlertingSource metrics = new MetricsAlertingSource();
        metrics.setId("old");
        metrics.setName("prod");
        metrics.setUrl("http://am");
        TriggerSystemSource trigger = new TriggerSystemSource();
        trigger.setId("never");
        trigger.setUrl("http://zbx");
        UptimeCheckSource fresh = new UptimeCheckSource();
        fresh.setId("fresh");
        fresh.setBaseUrl("http://kuma");
        UptimeCheckSource unconfigured = new UptimeCheckSource();
        unconfigured.setId("empty");
        unconfigured.setBaseUrl("");
        Settings settings = new Settings();
        settings.setMetricsSources(List.of(metrics));
        settings.setTriggerSources(List.of(trigger));
        settings.setUptimeSources(List.of(fresh, unconfigured));

        SourceHealthReporter reporter = new SourceHealthReporter(tracker, Duration.ofMinutes(5),
                Clock.fixed(NOW, ZoneOffset.UTC));
        HealthOverview overview = reporter.report(settings);

        assertThat(overview.getStaleThresholdMs()).isEqualTo(300_000L);
        assertThat(overview.getSources()).extracting(HealthOverview.SourceStatus::getSourceId)
                .containsExactly("old", "never", "fresh");
        assertThat(overview.getSources().get(0).getSourceLabel()).isEqualTo("prod");
        assertThat(overview.getSources().get(2).getFailCount()).isZero();
        assertThat(overview.getStaleSources()).extracting(HealthOverview.SourceStatus::getSourceId)
                .containsExactly("old", "never");
    }
}
