package alerthub.settings;

/**
 * 设置来源，由外部协作方提供
 */
public interface SettingsProvider {
    Settings current();
}
