package alerthub.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 告警来源类型
 */
public enum AlertSource {
    METRICS_ALERTING("Prometheus"),
    TRIGGER_SYSTEM("Zabbix"),
    UPTIME_CHECK("Kuma");

    private final String displayName;

    AlertSource(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * 兼容枚举名和展示名两种写法
     */
    @JsonCreator
    public static AlertSource fromString(String value) {
        if (value == null) {
            return null;
        }
        for (AlertSource source : values()) {
            if (source.name().equalsIgnoreCase(value) || source.displayName.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown alert source: " + value);
    }
}
