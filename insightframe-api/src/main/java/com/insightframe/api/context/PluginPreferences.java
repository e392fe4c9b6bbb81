package com.insightframe.api.context;

/**
 * 插件私有键值偏好
 */
public interface PluginPreferences {

    String getString(String key, String defaultValue);

    void setString(String key, String value);

    boolean getBoolean(String key, boolean defaultValue);

    void setBoolean(String key, boolean value);
}
