package alerthub.aggregator;

import alerthub.model.Alert;
import alerthub.model.SilenceRule;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 静默规则匹配，过滤掉当前被静默的告警
 */
public class SilenceMatcher {
    private static final Logger logger = LoggerFactory.getLogger(SilenceMatcher.class);

    private final Clock clock;

    public SilenceMatcher(Clock clock) {
        this.clock = clock;
    }

    public List<Alert> applySilences(List<Alert> alerts, List<SilenceRule> rules) {
        Instant now = clock.instant();
        List<SilenceRule> active = rules.stream()
                .filter(Objects::nonNull)
                .filter(rule -> rule.isActive(now))
                .collect(Collectors.toList());
        if (active.isEmpty()) {
            return alerts;
        }
        return alerts.stream()
                .filter(alert -> !isSilenced(alert, active))
                .collect(Collectors.toList());
    }

    private boolean isSilenced(Alert alert, List<SilenceRule> activeRules) {
        for (SilenceRule rule : activeRules) {
            if (matches(rule, alert)) {
                logger.debug("告警被静默: {} ({}), 规则: {}", alert.getName(), alert.getId(), rule.getName());
                return true;
            }
        }
        return false;
    }

    /**
     * 规则中所有已指定的条件都满足才算匹配
     */
    public static boolean matches(SilenceRule rule, Alert alert) {
        if (rule.getSourceType() != null && rule.getSourceType() != alert.getSource()) {
            return false;
        }
        if (StringUtils.isNotBlank(rule.getSourceId()) && !rule.getSourceId().equals(alert.getSourceId())) {
            return false;
        }
        if (StringUtils.isNotBlank(rule.getSourceLabel())
                && !rule.getSourceLabel().trim().equalsIgnoreCase(StringUtils.trimToEmpty(alert.getSourceLabel()))) {
            return false;
        }
        if (rule.getSeverity() != null && rule.getSeverity() != alert.getSeverity()) {
            return false;
        }
        return GlobPattern.matches(rule.getServicePattern(), alert.getService())
                && GlobPattern.matches(rule.getEnvironmentPattern(), alert.getEnvironment())
                && GlobPattern.matches(rule.getAlertNamePattern(), alert.getName())
                && GlobPattern.matches(rule.getInstancePattern(), alert.getInstance());
    }
}
