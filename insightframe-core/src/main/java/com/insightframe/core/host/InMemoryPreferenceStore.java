package com.insightframe.core.host;

import com.insightframe.core.spi.PreferenceStore;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存偏好存储，进程退出即丢失
 */
public class InMemoryPreferenceStore implements PreferenceStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public String getString(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    @Override
    public void setString(String key, String value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(values);
    }
}
