package alerthub.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Severity fromString(String value) {
        if (value == null) {
            return null;
        }
        return Severity.valueOf(value.trim().toUpperCase());
    }
}
