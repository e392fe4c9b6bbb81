package com.insightframe.runtime.host;

import com.insightframe.api.exception.InsightFrameException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PropertiesPreferenceStore 单元测试")
class PropertiesPreferenceStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("写入后重新打开仍能读到")
    void persistsAcrossInstances() {
        Path file = tempDir.resolve("nested").resolve("prefs.properties");
        PropertiesPreferenceStore store = new PropertiesPreferenceStore(file);

        store.setBoolean("plugin_enabled_alpha", true);
        store.setString("plugin_pref_alpha_enabled-analyses", "risk-assessment");

        PropertiesPreferenceStore reopened = new PropertiesPreferenceStore(file);
        assertTrue(reopened.getBoolean("plugin_enabled_alpha", false));
        assertEquals("risk-assessment", reopened.getString("plugin_pref_alpha_enabled-analyses", null));
        assertFalse(Files.exists(file.resolveSibling("prefs.properties.tmp")));
    }

    @Test
    @DisplayName("删除与写入 null 都会移除键")
    void removeKeys() {
        Path file = tempDir.resolve("prefs.properties");
        PropertiesPreferenceStore store = new PropertiesPreferenceStore(file);
        store.setString("a", "1");
        store.setString("b", "2");

        store.remove("a");
        store.setString("b", null);

        PropertiesPreferenceStore reopened = new PropertiesPreferenceStore(file);
        assertEquals("default", reopened.getString("a", "default"));
        assertNull(reopened.getString("b", null));
    }

    @Test
    @DisplayName("文件不存在时为空，无法落盘时报错")
    void missingAndUnwritable() throws Exception {
        PropertiesPreferenceStore empty = new PropertiesPreferenceStore(tempDir.resolve("absent.properties"));
        assertTrue(empty.getBoolean("anything", true));

        // 父路径是普通文件，无法创建目录
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        PropertiesPreferenceStore broken = new PropertiesPreferenceStore(blocker.resolve("prefs.properties"));
        assertThrows(InsightFrameException.class, () -> broken.setString("k", "v"));
    }
}
