package com.insightframe.core.loader;

import com.insightframe.core.exception.ManifestInvalidException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginStore 单元测试")
class PluginStoreTest {

    @TempDir
    Path tempDir;

    private PluginStore store;
    private Path staged;

    @BeforeEach
    void setUp() throws Exception {
        store = new PluginStore(tempDir.resolve("store"));
        staged = tempDir.resolve("staged.bin");
        Files.writeString(staged, "payload");
    }

    @Test
    @DisplayName("写入、覆盖与删除")
    void writeReplaceDelete() throws Exception {
        Path target = store.write("alpha", staged);
        assertEquals(tempDir.resolve("store").resolve("alpha.jar"), target);
        assertTrue(store.contains("alpha"));

        Files.writeString(staged, "v2");
        store.write("alpha", staged);
        assertEquals("v2", Files.readString(target));

        assertTrue(store.delete("alpha"));
        assertFalse(store.delete("alpha"));
        assertFalse(store.contains("alpha"));
    }

    @Test
    @DisplayName("按文件名排序列出插件包，忽略其他文件")
    void listSorted() throws Exception {
        store.write("beta", staged);
        store.write("alpha", staged);
        Files.writeString(tempDir.resolve("store").resolve("notes.txt"), "ignored");

        List<Path> archives = store.list();

        assertEquals(List.of("alpha", "beta"), archives.stream().map(PluginStore::idFromFileName).toList());
    }

    @Test
    @DisplayName("目录不存在时创建并返回空列表")
    void listCreatesDirectory() {
        assertTrue(store.list().isEmpty());
        assertTrue(Files.isDirectory(tempDir.resolve("store")));
    }

    @Test
    @DisplayName("ID 中不能包含路径分隔符")
    void rejectsUnsafeIds() {
        assertThrows(ManifestInvalidException.class, () -> store.pathOf("../escape"));
        assertThrows(ManifestInvalidException.class, () -> store.pathOf("a/b"));
        assertThrows(ManifestInvalidException.class, () -> store.pathOf(""));
        assertDoesNotThrow(() -> store.pathOf("smart-pattern-recognition_1.0"));
    }
}
