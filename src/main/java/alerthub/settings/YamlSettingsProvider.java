package alerthub.settings;

import alerthub.utils.AlertHubException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * 基于YAML文件的设置，文件修改后自动重新加载；重新加载失败时保留上次成功加载的设置
 */
@Slf4j
public class YamlSettingsProvider implements SettingsProvider {
    private final Path path;
    private volatile Settings cached;
    private volatile FileTime cachedModifiedTime;

    public YamlSettingsProvider(Path path) {
        this.path = path;
    }

    @Override
    public Settings current() {
        FileTime modified = lastModified();
        Settings settings = cached;
        if (settings != null && (modified == null || modified.equals(cachedModifiedTime))) {
            return settings;
        }
        synchronized (this) {
            if (cached == null || modified == null || !modified.equals(cachedModifiedTime)) {
                if (modified == null) {
                    log.warn("设置文件不存在: {}", path.toAbsolutePath());
                }
                Settings loaded;
                try {
                    loaded = SettingsLoader.load(path);
                } catch (AlertHubException e) {
                    if (cached == null) {
                        throw e;
                    }
                    // 同一次修改只告警一次，文件再次修改后重试
                    cachedModifiedTime = modified;
                    log.warn("重新加载设置文件失败, 继续使用上次的设置: {}", path.toAbsolutePath(), e);
                    return cached;
                }
                cached = loaded;
                cachedModifiedTime = modified;
                log.info("已加载数据源设置: {} 个数据源, 刷新间隔 {}秒",
                        cached.getConfiguredSources().size(), cached.getRefreshIntervalSeconds());
            }
            return cached;
        }
    }

    private FileTime lastModified() {
        try {
            return Files.isRegularFile(path) ? Files.getLastModifiedTime(path) : null;
        } catch (IOException e) {
            log.warn("读取设置文件修改时间失败: {}", path, e);
            return null;
        }
    }
}
