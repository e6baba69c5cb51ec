package alerthub.scheduler;

import alerthub.aggregator.AlertService;
import alerthub.model.AlertSnapshot;
import alerthub.settings.SettingsProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.config.TriggerTask;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 按设置中的刷新间隔周期性拉取告警，每次执行后重新读取间隔
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "alerthub.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class AlertPollingScheduler implements SchedulingConfigurer {
    private final AlertService alertService;
    private final SettingsProvider settingsProvider;
    private final Clock clock;

    private volatile AlertSnapshot latestSnapshot;

    public AlertPollingScheduler(AlertService alertService, SettingsProvider settingsProvider, Clock clock) {
        this.alertService = alertService;
        this.settingsProvider = settingsProvider;
        this.clock = clock;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.addTriggerTask(new TriggerTask(this::poll, refreshTrigger()));
    }

    Trigger refreshTrigger() {
        return triggerContext -> {
            Instant last = triggerContext.lastCompletion();
            if (last == null) {
                return clock.instant();
            }
            return last.plus(Duration.ofSeconds(settingsProvider.current().getRefreshIntervalSeconds()));
        };
    }

    void poll() {
        try {
            AlertSnapshot snapshot = alertService.snapshot(false);
            latestSnapshot = snapshot;
            log.info("定时拉取完成: 告警{}条, 错误{}条, 陈旧数据源{}个",
                    snapshot.getAlerts().size(), snapshot.getErrors().size(),
                    snapshot.getHealth().getStaleSources().size());
        } catch (RuntimeException e) {
            log.error("定时拉取告警失败", e);
        }
    }

    public Optional<AlertSnapshot> latestSnapshot() {
        return Optional.ofNullable(latestSnapshot);
    }
}
