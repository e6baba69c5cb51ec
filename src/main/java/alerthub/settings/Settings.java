package alerthub.settings;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 数据源设置
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Settings {
    public static final int DEFAULT_REFRESH_INTERVAL_SECONDS = 30;

    private List<MetricsAlertingSource> metricsSources = new ArrayList<>();
    private List<TriggerSystemSource> triggerSources = new ArrayList<>();
    private List<UptimeCheckSource> uptimeSources = new ArrayList<>();
    private int refreshIntervalSeconds = DEFAULT_REFRESH_INTERVAL_SECONDS;

    /**
     * 按 类型->配置顺序 返回所有已配置地址的数据源
     */
    @JsonIgnore
    public List<SourceConfig> getConfiguredSources() {
        return Stream.of(metricsSources, triggerSources, uptimeSources)
                .flatMap(List::stream)
                .filter(SourceConfig::isConfigured)
                .collect(Collectors.toList());
    }
}
