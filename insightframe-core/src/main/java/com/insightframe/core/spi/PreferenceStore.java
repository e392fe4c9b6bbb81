package com.insightframe.core.spi;

/**
 * 宿主偏好存储 SPI (字符串键值)
 * <p>
 * Core 只约定键空间：
 * <ul>
 *     <li>{@code plugin_enabled_<id>}：插件启停开关</li>
 *     <li>{@code plugin_pref_<id>_<key>}：插件私有设置</li>
 * </ul>
 */
public interface PreferenceStore {

    String getString(String key, String defaultValue);

    void setString(String key, String value);

    default boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    default void setBoolean(String key, boolean value) {
        setString(key, Boolean.toString(value));
    }

    void remove(String key);
}
