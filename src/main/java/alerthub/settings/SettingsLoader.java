package alerthub.settings;

import alerthub.utils.AlertHubException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 从YAML文件加载并规范化数据源设置
 */
public final class SettingsLoader {
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private SettingsLoader() {
    }

    /**
     * 加载设置文件，文件不存在时返回空设置
     */
    public static Settings load(Path path) {
        if (!Files.isRegularFile(path)) {
            return new Settings();
        }
        try {
            Settings settings = yamlMapper.readValue(new File(path.toAbsolutePath().toString()), Settings.class);
            return normalize(settings == null ? new Settings() : settings);
        } catch (Exception e) {
            throw new AlertHubException("加载设置文件失败: " + path, e);
        }
    }

    public static Settings normalize(Settings settings) {
        Settings normalized = new Settings();
        normalized.setMetricsSources(normalizeList(settings.getMetricsSources(), source -> {
            source.setUrl(StringUtils.trimToEmpty(source.getUrl()));
            source.setAuthValue(StringUtils.trimToEmpty(source.getAuthValue()));
            if (source.getAuthType() == null) {
                source.setAuthType(AuthType.NONE);
            }
        }));
        normalized.setTriggerSources(normalizeList(settings.getTriggerSources(), source -> {
            source.setUrl(StringUtils.trimToEmpty(source.getUrl()));
            source.setToken(StringUtils.trimToEmpty(source.getToken()));
        }));
        normalized.setUptimeSources(normalizeList(settings.getUptimeSources(), source -> {
            source.setBaseUrl(StringUtils.trimToEmpty(source.getBaseUrl()));
            source.setSlug(StringUtils.trimToEmpty(source.getSlug()));
            source.setKey(StringUtils.trimToEmpty(source.getKey()));
            if (source.getMode() == null) {
                source.setMode(UptimeMode.STATUS);
            }
        }));
        int interval = settings.getRefreshIntervalSeconds();
        normalized.setRefreshIntervalSeconds(interval > 0 ? interval : Settings.DEFAULT_REFRESH_INTERVAL_SECONDS);
        return normalized;
    }

    private static <T extends SourceConfig> List<T> normalizeList(List<T> sources, Consumer<T> fields) {
        if (sources == null) {
            return new ArrayList<>();
        }
        Set<String> derivedIds = new HashSet<>();
        return sources.stream()
                .filter(Objects::nonNull)
                .peek(source -> {
                    source.setName(StringUtils.trimToEmpty(source.getName()));
                    fields.accept(source);
                    if (StringUtils.isBlank(source.getId())) {
                        source.setId(deriveId(source, derivedIds));
                    } else {
                        source.setId(source.getId().trim());
                    }
                })
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * 未配置id时由类型、地址和名称生成，重复加载结果不变；同一列表内相同配置按出现顺序加后缀
     */
    static String deriveId(SourceConfig source, Set<String> used) {
        String base = DigestUtils.sha1Hex(String.join("|",
                source.getSourceType().name(), source.getEndpoint(), source.getName())).substring(0, 16);
        String id = base;
        for (int n = 2; !used.add(id); n++) {
            id = base + "-" + n;
        }
        return id;
    }
}
