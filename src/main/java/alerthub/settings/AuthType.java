package alerthub.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AuthType {
    NONE,
    BASIC,
    BEARER;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    /**
     * 未知取值回退为NONE
     */
    @JsonCreator
    public static AuthType fromString(String value) {
        if ("basic".equalsIgnoreCase(value)) {
            return BASIC;
        }
        if ("bearer".equalsIgnoreCase(value)) {
            return BEARER;
        }
        return NONE;
    }
}
