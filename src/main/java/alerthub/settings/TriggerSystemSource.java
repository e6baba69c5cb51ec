package alerthub.settings;

import alerthub.model.AlertSource;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Zabbix 数据源
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class TriggerSystemSource extends SourceConfig {
    private String url;
    private String token;

    @Override
    public AlertSource getSourceType() {
        return AlertSource.TRIGGER_SYSTEM;
    }

    @Override
    public String getEndpoint() {
        return url;
    }
}
