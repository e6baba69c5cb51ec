package alerthub.settings;

import alerthub.model.AlertSource;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

/**
 * 数据源配置基类
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class SourceConfig {
    private String id;
    private String name;

    @JsonIgnore
    public abstract AlertSource getSourceType();

    /**
     * 上游地址，未配置的数据源不参与拉取
     */
    @JsonIgnore
    public abstract String getEndpoint();

    @JsonIgnore
    public boolean isConfigured() {
        return StringUtils.isNotBlank(getEndpoint());
    }

    /**
     * 错误和健康展示用的标签，如 "Prometheus (prod)"
     */
    @JsonIgnore
    public String getDisplayLabel() {
        String type = getSourceType().getDisplayName();
        return StringUtils.isNotBlank(name) ? type + " (" + name + ")" : type;
    }
}
