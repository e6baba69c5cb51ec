package alerthub.scheduler;

import alerthub.aggregator.AlertService;
import alerthub.model.AlertSnapshot;
import alerthub.model.HealthOverview;
import alerthub.settings.Settings;
import alerthub.settings.SettingsProvider;
import alerthub.utils.AlertHubException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.SimpleTriggerContext;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertPollingSchedulerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private AlertService alertService;

    @Mock
    private SettingsProvider settingsProvider;

    private AlertPollingScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new AlertPollingScheduler(alertService, settingsProvider, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void firstRunStartsImmediately() {
        Trigger trigger = scheduler.refreshTrigger();

        assertThat(trigger.nextExecution(new SimpleTriggerContext())).isEqualTo(NOW);
    }

    @Test
    void nextRunUsesCurrentRefreshInterval() {
        Settings settings = new Settings();
        settings.setRefreshIntervalSeconds(45);
        when(settingsProvider.current()).thenReturn(settings);
        Instant completed = NOW.minusSeconds(5);

        Instant next = scheduler.refreshTrigger()
                .nextExecution(new SimpleTriggerContext(completed.minusSeconds(2), completed.minusSeconds(2), completed));

        assertThat(next).isEqualTo(completed.plusSeconds(45));
    }

    @Test
    void pollKeepsLatestSnapshot() {
        AlertSnapshot snapshot = new AlertSnapshot(List.of(), List.of(),
                HealthOverview.builder().sources(List.of()).staleSources(List.of()).build());
        when(alertService.snapshot(false)).thenReturn(snapshot);

        scheduler.poll();

        assertThat(scheduler.latestSnapshot()).containsSame(snapshot);
    }

    @Test
    void failedPollIsLoggedAndPreviousSnapshotKept() {
        AlertSnapshot snapshot = new AlertSnapshot(List.of(), List.of(),
                HealthOverview.builder().sources(List.of()).staleSources(List.of()).build());
        when(alertService.snapshot(false))
                .thenReturn(snapshot)
                .thenThrow(new AlertHubException("拉取失败"));

        scheduler.poll();
        scheduler.poll();

        assertThat(scheduler.latestSnapshot()).containsSame(snapshot);
    }
}
