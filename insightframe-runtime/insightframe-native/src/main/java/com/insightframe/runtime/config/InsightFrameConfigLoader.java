package com.insightframe.runtime.config;

import com.insightframe.api.exception.InsightFrameException;
import com.insightframe.core.config.InsightFrameConfig;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * 读取 insightframe.yml
 * <pre>
 * insightframe:
 *   plugin-home: plugins
 *   auto-scan: true
 *   load-timeout-ms: 5000
 * </pre>
 * 键同时接受 kebab-case 和驼峰写法，缺省项使用默认值
 */
@Slf4j
public final class InsightFrameConfigLoader {

    public static final String DEFAULT_RESOURCE = "insightframe.yml";

    private static final String ROOT_KEY = "insightframe";

    private InsightFrameConfigLoader() {
    }

    /**
     * 从类路径读取，资源不存在时返回默认配置
     */
    public static InsightFrameConfig loadFromClasspath() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = InsightFrameConfigLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return InsightFrameConfig.builder().build();
            }
            return load(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new InsightFrameException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static InsightFrameConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new InsightFrameException("Failed to read config " + file, e);
        }
    }

    public static InsightFrameConfig load(InputStream in, String label) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new InsightFrameException("Malformed config " + label + ": " + e.getMessage(), e);
        }

        InsightFrameConfig.InsightFrameConfigBuilder builder = InsightFrameConfig.builder();
        if (!(root instanceof Map<?, ?> document)) {
            return builder.build();
        }
        Object section = document.get(ROOT_KEY);
        if (!(section instanceof Map<?, ?> values)) {
            return builder.build();
        }

        for (Map.Entry<?, ?> entry : values.entrySet()) {
            String key = normalize(String.valueOf(entry.getKey()));
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case "pluginhome" -> builder.pluginHome(value.toString());
                case "autoscan" -> builder.autoScan(bool(value));
                case "loadtimeoutms" -> builder.loadTimeoutMs(number(value, key, label).longValue());
                case "analyticstimeoutms" -> builder.analyticsTimeoutMs(number(value, key, label).longValue());
                case "maxanalyticsworkers" -> builder.maxAnalyticsWorkers(number(value, key, label).intValue());
                case "enforcepermissions" -> builder.enforcePermissions(bool(value));
                case "builtinsenabledbydefault" -> builder.builtinsEnabledByDefault(bool(value));
                case "preferencesfile" -> builder.preferencesFile(value.toString());
                default -> log.warn("Unknown config key '{}' in {}", entry.getKey(), label);
            }
        }
        InsightFrameConfig config = builder.build();
        log.info("Loaded config from {}: {}", label, config);
        return config;
    }

    private static String normalize(String key) {
        return key.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }

    private static boolean bool(Object value) {
        return value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString().trim());
    }

    private static Number number(Object value, String key, String label) {
        if (value instanceof Number n) {
            return n;
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InsightFrameException("Config key '" + key + "' in " + label + " must be a number: " + value, e);
        }
    }
}
