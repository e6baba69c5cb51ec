package alerthub.aggregator;

import alerthub.ack.AckStateService;
import alerthub.health.SourceHealthReporter;
import alerthub.health.SourceHealthTracker;
import alerthub.log.AlertLogService;
import alerthub.model.AckState;
import alerthub.model.AckStatus;
import alerthub.model.Alert;
import alerthub.model.AlertFetchResult;
import alerthub.model.AlertGroup;
import alerthub.model.AlertSnapshot;
import alerthub.model.AlertSource;
import alerthub.model.AlertView;
import alerthub.model.GroupAckState;
import alerthub.model.SilenceRule;
import alerthub.model.SourceHealth;
import alerthub.model.SourceProbeResult;
import alerthub.settings.Settings;
import alerthub.settings.SettingsProvider;
import alerthub.settings.SourceConfig;
import alerthub.silence.SilenceService;
import alerthub.source.SourceAdapter;
import alerthub.source.SourceFetchException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 告警聚合入口：拉取 -> 记录历史 -> 自动恢复 -> 静默过滤 -> 排序 -> 合并确认状态 -> （可选）分组
 */
@Slf4j
public class AlertService {
    private final SettingsProvider settingsProvider;
    private final FetchOrchestrator orchestrator;
    private final Map<AlertSource, SourceAdapter<?>> adapters;
    private final AlertGrouper grouper;
    private final SilenceMatcher silenceMatcher;
    private final SilenceService silenceService;
    private final AckStateService ackStateService;
    private final AlertLogService alertLogService;
    private final SourceHealthTracker healthTracker;
    private final SourceHealthReporter healthReporter;
    private final AutoResolvePolicy autoResolvePolicy;

    public AlertService(SettingsProvider settingsProvider,
                        FetchOrchestrator orchestrator,
                        Collection<? extends SourceAdapter<?>> adapters,
                        AlertGrouper grouper,
                        SilenceMatcher silenceMatcher,
                        SilenceService silenceService,
                        AckStateService ackStateService,
                        AlertLogService alertLogService,
                        SourceHealthTracker healthTracker,
                        SourceHealthReporter healthReporter,
                        AutoResolvePolicy autoResolvePolicy) {
        this.settingsProvider = settingsProvider;
        this.orchestrator = orchestrator;
        this.adapters = new EnumMap<>(AlertSource.class);
        adapters.forEach(adapter -> this.adapters.put(adapter.getSourceType(), adapter));
        this.grouper = grouper;
        this.silenceMatcher = silenceMatcher;
        this.silenceService = silenceService;
        this.ackStateService = ackStateService;
        this.alertLogService = alertLogService;
        this.healthTracker = healthTracker;
        this.healthReporter = healthReporter;
        this.autoResolvePolicy = autoResolvePolicy;
    }

    /**
     * 一次完整的拉取，返回合并了确认状态的告警、错误列表和健康概览。
     * 静默在分组之前作用于原始告警，被静默的告警不计入分组大小。
     */
    public AlertSnapshot snapshot(boolean grouped) {
        Settings settings = settingsProvider.current();
        AlertFetchResult result = orchestrator.fetchAll(settings);
        List<Alert> alerts = result.getAlerts();

        try {
            alertLogService.record(alerts);
        } catch (RuntimeException e) {
            log.error("写入告警历史失败", e);
        }

        List<String> observedIds = alerts.stream().map(Alert::getId).collect(Collectors.toList());
        if (shouldResolveMissing(result)) {
            try {
                ackStateService.resolveMissingStates(observedIds);
            } catch (RuntimeException e) {
                log.error("自动恢复告警状态失败", e);
            }
        } else if (autoResolvePolicy == AutoResolvePolicy.SKIP_ON_ERRORS) {
            log.info("本次拉取有{}个数据源出错, 跳过自动恢复", result.getErrors().size());
        }

        List<Alert> visible = new ArrayList<>(applySilences(alerts, silenceService.activeRules()));
        visible.sort(AlertGrouper.NEWEST_FIRST);
        if (visible.size() < alerts.size()) {
            log.debug("静默过滤告警{}条", alerts.size() - visible.size());
        }

        Map<String, AckState> states = ackStateService.statesFor(
                visible.stream().map(Alert::getId).collect(Collectors.toList()));
        List<AlertView> views = grouped ? groupedViews(visible, states) : flatViews(visible, states);
        return new AlertSnapshot(views, result.getErrors(), healthReporter.report(settings));
    }

    private boolean shouldResolveMissing(AlertFetchResult result) {
        switch (autoResolvePolicy) {
            case ALWAYS:
                return true;
            case SKIP_ON_ERRORS:
                return result.getErrors().isEmpty();
            default:
                return false;
        }
    }

    private List<AlertView> flatViews(List<Alert> alerts, Map<String, AckState> states) {
        List<AlertView> views = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            AckState state = states.get(alert.getId());
            AlertView.AlertViewBuilder view = AlertView.builder()
                    .alert(alert)
                    .ackStatus(AckStatus.ACTIVE);
            if (state != null) {
                view.ackStatus(state.getStatus())
                        .ackNote(state.getNote())
                        .ackUpdatedAt(state.getUpdatedAt())
                        .ackUpdatedBy(state.getUpdatedBy())
                        .acknowledgedAt(state.getAcknowledgedAt())
                        .resolvedAt(state.getResolvedAt());
            }
            views.add(view.build());
        }
        return views;
    }

    private List<AlertView> groupedViews(List<Alert> alerts, Map<String, AckState> states) {
        List<AlertView> views = new ArrayList<>();
        for (AlertGroup group : grouper.group(alerts)) {
            List<AckState> memberStates = group.getGroupedAlertIds().stream()
                    .map(states::get)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
            GroupAckState groupState = AckStateService.aggregate(memberStates);
            views.add(AlertView.builder()
                    .alert(group.getRepresentative())
                    .ackStatus(groupState.getStatus())
                    .ackNote(groupState.getNote())
                    .ackUpdatedAt(groupState.getUpdatedAt())
                    .ackUpdatedBy(groupState.getUpdatedBy())
                    .acknowledgedAt(groupState.getAcknowledgedAt())
                    .resolvedAt(groupState.getResolvedAt())
                    .groupKey(group.getGroupKey())
                    .groupSize(group.getGroupSize())
                    .groupedAlertIds(group.getGroupedAlertIds())
                    .build());
        }
        return views;
    }

    public AlertFetchResult fetchAll(Settings settings) {
        return orchestrator.fetchAll(settings);
    }

    public List<AlertGroup> group(List<Alert> alerts) {
        return grouper.group(alerts);
    }

    public List<Alert> applySilences(List<Alert> alerts, List<SilenceRule> rules) {
        return silenceMatcher.applySilences(alerts, rules);
    }

    public AckState upsertAckState(String alertId, AckStatus status, String note, String userId) {
        return ackStateService.upsertState(alertId, status, note, userId);
    }

    public List<AckState> upsertAckStatesBulk(Collection<String> alertIds, AckStatus status, String note, String userId) {
        return ackStateService.upsertStates(alertIds, status, note, userId);
    }

    public GroupAckState aggregateGroupState(Collection<String> memberIds) {
        return ackStateService.aggregateGroupState(memberIds);
    }

    public Optional<SourceHealth> getHealth(AlertSource sourceType, String sourceId) {
        return healthTracker.getHealth(sourceType, sourceId);
    }

    public List<SourceHealth> listHealth() {
        return healthTracker.listHealth();
    }

    /**
     * 测试已保存的数据源
     */
    public SourceProbeResult testSource(AlertSource sourceType, String sourceId) {
        Optional<SourceConfig> source = settingsProvider.current().getConfiguredSources().stream()
                .filter(config -> config.getSourceType() == sourceType && StringUtils.equals(config.getId(), sourceId))
                .findFirst();
        if (source.isEmpty()) {
            return SourceProbeResult.failed(sourceType.getDisplayName() + " source not found: " + sourceId);
        }
        return testSource(source.get());
    }

    /**
     * 测试任意数据源配置（可以是尚未保存的草稿），不更新健康记录
     */
    public SourceProbeResult testSource(SourceConfig source) {
        if (!source.isConfigured()) {
            return SourceProbeResult.failed(source.getSourceType().getDisplayName() + " URL required");
        }
        SourceAdapter<?> adapter = adapters.get(source.getSourceType());
        if (adapter == null) {
            return SourceProbeResult.failed("No adapter registered for " + source.getSourceType().getDisplayName());
        }
        try {
            return SourceProbeResult.connected(adapter.probeConfig(source).orElse(null));
        } catch (SourceFetchException e) {
            log.warn("数据源测试失败: {}, {}", source.getDisplayLabel(), e.getMessage());
            return SourceProbeResult.failed(e.getMessage());
        }
    }
}
