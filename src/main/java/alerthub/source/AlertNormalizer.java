package alerthub.source;

import alerthub.model.Severity;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 各数据源共用的归一化规则：级别、时间、告警ID、地址拼接
 */
public final class AlertNormalizer {

    private AlertNormalizer() {
    }

    /**
     * 关键字/数字优先级映射为统一级别
     */
    public static Severity normalizeSeverity(String input) {
        String value = StringUtils.trimToEmpty(input).toLowerCase(Locale.ROOT);
        if (value.contains("crit") || value.contains("high") || value.contains("disaster")
                || value.equals("5") || value.equals("4")) {
            return Severity.CRITICAL;
        }
        if (value.contains("warn") || value.contains("average") || value.equals("3") || value.equals("2")) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    /**
     * 解析上游时间，缺失或无法解析时取now
     */
    public static Instant parseTimestamp(String raw, Instant now) {
        String value = StringUtils.trimToNull(raw);
        if (value == null) {
            return now;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value.replace(' ', 'T'), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            // 无时区信息按UTC处理
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return now;
        }
    }

    /**
     * 秒级时间戳，缺失或非法时取now
     */
    public static Instant fromEpochSeconds(String raw, Instant now) {
        String value = StringUtils.trimToNull(raw);
        if (value == null) {
            return now;
        }
        try {
            long seconds = Long.parseLong(value);
            return seconds > 0 ? Instant.ofEpochSecond(seconds) : now;
        } catch (NumberFormatException e) {
            return now;
        }
    }

    /**
     * 稳定字段拼接后取SHA-1，空字段跳过
     */
    public static String alertId(Object... parts) {
        String joined = Arrays.stream(parts)
                .filter(Objects::nonNull)
                .map(Object::toString)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.joining("|"));
        return DigestUtils.sha1Hex(joined);
    }

    public static String appendPath(String baseUrl, String pathSuffix) {
        String trimmed = StringUtils.stripEnd(StringUtils.trimToEmpty(baseUrl), "/");
        if (trimmed.endsWith(pathSuffix)) {
            return trimmed;
        }
        return trimmed + pathSuffix;
    }

    public static String withSourceName(String message, String sourceName) {
        return StringUtils.isNotBlank(sourceName) ? message + " (" + sourceName + ")" : message;
    }
}
