package alerthub.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 确认状态，priority越小在分组合并时越优先
 */
public enum AckStatus {
    ACTIVE(0),
    ACKNOWLEDGED(1),
    RESOLVED(2);

    private final int priority;

    AckStatus(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AckStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        return AckStatus.valueOf(value.trim().toUpperCase());
    }
}
