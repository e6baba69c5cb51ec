package alerthub.settings;

import alerthub.model.AlertSource;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Prometheus Alertmanager 数据源
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class MetricsAlertingSource extends SourceConfig {
    private String url;
    private AuthType authType = AuthType.NONE;
    private String authValue;

    @Override
    public AlertSource getSourceType() {
        return AlertSource.METRICS_ALERTING;
    }

    @Override
    public String getEndpoint() {
        return url;
    }
}
