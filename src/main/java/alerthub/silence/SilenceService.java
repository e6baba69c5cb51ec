package alerthub.silence;

import alerthub.model.SilenceRule;
import alerthub.utils.AlertHubException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 静默规则的增删改查和校验
 */
@Slf4j
public class SilenceService {
    private final SilenceRuleStore store;
    private final Clock clock;

    public SilenceService(SilenceRuleStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * includeExpired为false时过滤掉已过期的规则（停用但未过期的仍然返回）
     */
    public List<SilenceRule> list(boolean includeExpired) {
        List<SilenceRule> rules = store.list();
        if (includeExpired) {
            return rules;
        }
        Instant now = clock.instant();
        return rules.stream()
                .filter(rule -> rule.getEndsAt() == null || !rule.getEndsAt().isBefore(now))
                .collect(Collectors.toList());
    }

    public List<SilenceRule> activeRules() {
        Instant now = clock.instant();
        return store.list().stream()
                .filter(rule -> rule.isActive(now))
                .collect(Collectors.toList());
    }

    public SilenceRule create(SilenceRule input, String userId) {
        SilenceRule rule = normalize(input);
        Instant now = clock.instant();
        rule.setId(UUID.randomUUID().toString());
        rule.setCreatedBy(userId);
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        SilenceRule saved = store.save(rule);
        log.info("新增静默规则: {} ({}), {} ~ {}", saved.getName(), saved.getId(), saved.getStartsAt(), saved.getEndsAt());
        return saved;
    }

    public SilenceRule update(String id, SilenceRule input) {
        SilenceRule existing = store.find(id)
                .orElseThrow(() -> new AlertHubException("静默规则不存在: " + id));
        SilenceRule rule = normalize(input);
        rule.setId(existing.getId());
        rule.setCreatedBy(existing.getCreatedBy());
        rule.setCreatedAt(existing.getCreatedAt());
        rule.setUpdatedAt(clock.instant());
        SilenceRule saved = store.save(rule);
        log.info("更新静默规则: {} ({})", saved.getName(), saved.getId());
        return saved;
    }

    public boolean delete(String id) {
        boolean deleted = store.delete(id);
        if (deleted) {
            log.info("删除静默规则: {}", id);
        }
        return deleted;
    }

    /**
     * 校验并清理输入，空白的可选字段统一为null
     */
    static SilenceRule normalize(SilenceRule input) {
        if (input == null) {
            throw new IllegalArgumentException("Silence rule is required");
        }
        String name = StringUtils.trimToNull(input.getName());
        if (name == null) {
            throw new IllegalArgumentException("Name is required");
        }
        if (input.getStartsAt() == null || input.getEndsAt() == null) {
            throw new IllegalArgumentException("Start and end time are required");
        }
        if (!input.getEndsAt().isAfter(input.getStartsAt())) {
            throw new IllegalArgumentException("End time must be after start time");
        }
        return SilenceRule.builder()
                .name(name)
                .sourceType(input.getSourceType())
                .sourceId(StringUtils.trimToNull(input.getSourceId()))
                .sourceLabel(StringUtils.trimToNull(input.getSourceLabel()))
                .servicePattern(StringUtils.trimToNull(input.getServicePattern()))
                .environmentPattern(StringUtils.trimToNull(input.getEnvironmentPattern()))
                .alertNamePattern(StringUtils.trimToNull(input.getAlertNamePattern()))
                .instancePattern(StringUtils.trimToNull(input.getInstancePattern()))
                .severity(input.getSeverity())
                .startsAt(input.getStartsAt())
                .endsAt(input.getEndsAt())
                .enabled(input.isEnabled())
                .build();
    }
}
