package com.insightframe.runtime.config;

import com.insightframe.api.exception.InsightFrameException;
import com.insightframe.core.config.InsightFrameConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InsightFrameConfigLoader 单元测试")
class InsightFrameConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("同时接受 kebab-case 与驼峰键")
    void mixedKeyStyles() {
        InsightFrameConfig config = InsightFrameConfigLoader.load(yaml("""
                insightframe:
                  plugin-home: /opt/plugins
                  autoScan: false
                  load-timeout-ms: 1500
                  analyticsTimeoutMs: "250"
                  max_analytics_workers: 3
                  enforce-permissions: false
                  builtins-enabled-by-default: false
                  preferences-file: prefs.properties
                  unknown-key: ignored
                """), "test");

        assertEquals("/opt/plugins", config.getPluginHome());
        assertFalse(config.isAutoScan());
        assertEquals(1500L, config.getLoadTimeoutMs());
        assertEquals(250L, config.getAnalyticsTimeoutMs());
        assertEquals(3, config.getMaxAnalyticsWorkers());
        assertFalse(config.isEnforcePermissions());
        assertFalse(config.isBuiltinsEnabledByDefault());
        assertEquals("prefs.properties", config.getPreferencesFile());
    }

    @Test
    @DisplayName("缺少根节点或空文档时使用默认值")
    void defaults() {
        InsightFrameConfig defaults = InsightFrameConfig.builder().build();

        InsightFrameConfig empty = InsightFrameConfigLoader.load(yaml(""), "empty");
        InsightFrameConfig other = InsightFrameConfigLoader.load(yaml("server:\n  port: 80\n"), "other");

        assertEquals(defaults.getPluginHome(), empty.getPluginHome());
        assertEquals(defaults.getLoadTimeoutMs(), other.getLoadTimeoutMs());
        assertTrue(other.isAutoScan());
    }

    @Test
    @DisplayName("数值格式错误或 YAML 格式错误时报错")
    void invalidValues() {
        assertThrows(InsightFrameException.class,
                () -> InsightFrameConfigLoader.load(yaml("insightframe:\n  load-timeout-ms: soon\n"), "bad"));
        assertThrows(InsightFrameException.class,
                () -> InsightFrameConfigLoader.load(yaml("insightframe: [unclosed"), "bad"));
    }

    @Test
    @DisplayName("从文件和类路径读取")
    void fromFileAndClasspath() throws Exception {
        Path file = tempDir.resolve("insightframe.yml");
        Files.writeString(file, "insightframe:\n  plugin-home: from-file\n");

        assertEquals("from-file", InsightFrameConfigLoader.load(file).getPluginHome());
        assertEquals("target/test-plugins", InsightFrameConfigLoader.loadFromClasspath().getPluginHome());
        assertThrows(InsightFrameException.class, () -> InsightFrameConfigLoader.load(tempDir.resolve("absent.yml")));
    }
}
