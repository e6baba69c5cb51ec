package alerthub.source;

import alerthub.model.Alert;
import alerthub.model.AlertSource;
import alerthub.settings.SourceConfig;

import java.util.List;
import java.util.Optional;

/**
 * 数据源适配器：拉取一个配置的上游并映射为统一告警。
 * 失败统一抛出 {@link SourceFetchException}，适配器本身不写健康状态。
 */
public interface SourceAdapter<S extends SourceConfig> {

    AlertSource getSourceType();

    Class<S> getConfigType();

    List<Alert> fetch(S source);

    /**
     * 连通性测试，返回一行示例，无活动告警时为空
     */
    Optional<String> probe(S source);

    default List<Alert> fetchConfig(SourceConfig source) {
        return fetch(getConfigType().cast(source));
    }

    default Optional<String> probeConfig(SourceConfig source) {
        return probe(getConfigType().cast(source));
    }
}
