package alerthub.settings;

import alerthub.model.AlertSource;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Uptime Kuma 数据源，支持状态页和API Key两种模式
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class UptimeCheckSource extends SourceConfig {
    private String baseUrl;
    private UptimeMode mode = UptimeMode.STATUS;
    private String slug;
    private String key;

    @Override
    public AlertSource getSourceType() {
        return AlertSource.UPTIME_CHECK;
    }

    @Override
    public String getEndpoint() {
        return baseUrl;
    }
}
