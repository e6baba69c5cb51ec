package alerthub.ack;

import alerthub.model.AckState;
import alerthub.model.AckStatus;
import alerthub.model.GroupAckState;
import alerthub.utils.AlertHubException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 告警确认状态的更新、自动恢复和分组合并
 */
public class AckStateService {
    private static final Logger logger = LoggerFactory.getLogger(AckStateService.class);

    private final AckStateStore store;
    private final Clock clock;

    public AckStateService(AckStateStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * 新建或更新一条状态，note为null时保留原备注
     */
    public AckState upsertState(String alertId, AckStatus status, String note, String userId) {
        if (StringUtils.isBlank(alertId) || status == null) {
            throw new IllegalArgumentException("alertId and status are required");
        }
        Instant now = clock.instant();
        return store.compute(alertId, current -> transition(alertId, current, status, note, userId, now));
    }

    /**
     * 批量更新，每条独立写入；部分失败时其余照常写入，最后统一报错
     */
    public List<AckState> upsertStates(Collection<String> alertIds, AckStatus status, String note, String userId) {
        if (alertIds == null || alertIds.isEmpty()) {
            return List.of();
        }
        List<AckState> updated = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String alertId : new LinkedHashSet<>(alertIds)) {
            try {
                updated.add(upsertState(alertId, status, note, userId));
            } catch (RuntimeException e) {
                logger.error("更新告警状态失败: {}", alertId, e);
                failed.add(alertId);
            }
        }
        if (!failed.isEmpty()) {
            throw new AlertHubException("批量更新告警状态部分失败: " + failed.size() + "/" + alertIds.size()
                    + ", 失败id: " + failed);
        }
        return updated;
    }

    /**
     * 本次拉取中消失的告警自动置为resolved
     */
    public int resolveMissingStates(Collection<String> observedAlertIds) {
        Set<String> observed = new HashSet<>(observedAlertIds);
        Instant now = clock.instant();
        int resolved = 0;
        for (AckState state : store.findUnresolved()) {
            if (observed.contains(state.getAlertId())) {
                continue;
            }
            store.compute(state.getAlertId(), current -> current
                    .map(existing -> {
                        if (existing.getStatus() == AckStatus.RESOLVED) {
                            return existing;
                        }
                        existing.setStatus(AckStatus.RESOLVED);
                        existing.setResolvedAt(now);
                        existing.setUpdatedAt(now);
                        return existing;
                    })
                    .orElseGet(() -> state));
            resolved++;
        }
        if (resolved > 0) {
            logger.info("自动恢复已消失告警的状态: {}条", resolved);
        }
        return resolved;
    }

    public Map<String, AckState> statesFor(Collection<String> alertIds) {
        return store.findByIds(alertIds);
    }

    public GroupAckState aggregateGroupState(Collection<String> memberIds) {
        return aggregate(store.findByIds(memberIds).values());
    }

    /**
     * 分组状态优先级 active > acknowledged > resolved；
     * 备注和时间取 updatedAt 最新的一条；没有任何记录时为active
     */
    public static GroupAckState aggregate(Collection<AckState> states) {
        if (states.isEmpty()) {
            return GroupAckState.active();
        }
        AckStatus status = states.stream()
                .map(AckState::getStatus)
                .filter(Objects::nonNull)
                .min(Comparator.comparingInt(AckStatus::getPriority))
                .orElse(AckStatus.ACTIVE);
        AckState latest = states.stream()
                .max(Comparator.comparing(AckState::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .orElseThrow();
        return GroupAckState.builder()
                .status(status)
                .note(StringUtils.defaultString(latest.getNote()))
                .updatedAt(latest.getUpdatedAt())
                .updatedBy(latest.getUpdatedBy())
                .acknowledgedAt(latest.getAcknowledgedAt())
                .resolvedAt(latest.getResolvedAt())
                .build();
    }

    /**
     * 首次进入acknowledged/resolved时记录时间，已有时间不再覆盖；回到active不清除历史时间
     */
    static AckState transition(String alertId, Optional<AckState> current, AckStatus status,
                               String note, String userId, Instant now) {
        AckState state = current.orElseGet(() -> AckState.builder()
                .alertId(alertId)
                .note("")
                .createdAt(now)
                .build());
        state.setStatus(status);
        if (note != null) {
            state.setNote(note);
        }
        state.setUpdatedAt(now);
        state.setUpdatedBy(userId);
        if (status == AckStatus.ACKNOWLEDGED && state.getAcknowledgedAt() == null) {
            state.setAcknowledgedAt(now);
        }
        if (status == AckStatus.RESOLVED && state.getResolvedAt() == null) {
            state.setResolvedAt(now);
        }
        return state;
    }
}
