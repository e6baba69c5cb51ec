package alerthub.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UptimeMode {
    STATUS("status"),
    API_KEY("apiKey");

    private final String value;

    UptimeMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static UptimeMode fromString(String value) {
        return "apiKey".equalsIgnoreCase(value) || "api_key".equalsIgnoreCase(value) ? API_KEY : STATUS;
    }
}
