package com.insightframe.core.loader;

import com.insightframe.core.exception.ManifestInvalidException;
import com.insightframe.core.exception.StoreWriteFailedException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 插件仓库
 * 宿主本地目录，每个已安装插件对应一个以 ID 命名的 Jar 文件
 */
@Slf4j
public class PluginStore {

    public static final String EXTENSION = ".jar";

    // ID 直接作为文件名，禁止路径分隔符
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    @Getter
    private final Path directory;

    public PluginStore(Path directory) {
        this.directory = directory;
    }

    public Path pathOf(String pluginId) {
        if (pluginId == null || !SAFE_ID.matcher(pluginId).matches()) {
            throw new ManifestInvalidException(String.valueOf(pluginId), "id is not usable as a store file name");
        }
        return directory.resolve(pluginId + EXTENSION);
    }

    public boolean contains(String pluginId) {
        return Files.isRegularFile(pathOf(pluginId));
    }

    /**
     * 将暂存的插件包复制进仓库，已存在则覆盖
     */
    public Path write(String pluginId, Path staged) {
        Path target = pathOf(pluginId);
        try {
            Files.createDirectories(directory);
            Files.copy(staged, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("[{}] Stored plugin package at {}", pluginId, target);
            return target;
        } catch (IOException e) {
            throw new StoreWriteFailedException(pluginId, "write", e);
        }
    }

    /**
     * @return 是否确实删除了文件
     */
    public boolean delete(String pluginId) {
        try {
            return Files.deleteIfExists(pathOf(pluginId));
        } catch (IOException e) {
            throw new StoreWriteFailedException(pluginId, "delete", e);
        }
    }

    /**
     * 列出仓库中的全部插件包 (按文件名排序)
     * 目录不存在时创建并返回空列表
     */
    public List<Path> list() {
        try {
            if (!Files.isDirectory(directory)) {
                Files.createDirectories(directory);
                return Collections.emptyList();
            }
            List<Path> archives = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
                for (Path path : stream) {
                    if (Files.isRegularFile(path)) {
                        archives.add(path);
                    }
                }
            }
            Collections.sort(archives);
            return archives;
        } catch (IOException e) {
            log.error("Failed to scan plugin store {}", directory.toAbsolutePath(), e);
            return Collections.emptyList();
        }
    }

    /**
     * 由文件名推断的插件ID，用于清单不可读时的占位条目
     */
    public static String idFromFileName(Path archive) {
        String name = archive.getFileName().toString();
        return name.endsWith(EXTENSION) ? name.substring(0, name.length() - EXTENSION.length()) : name;
    }
}
