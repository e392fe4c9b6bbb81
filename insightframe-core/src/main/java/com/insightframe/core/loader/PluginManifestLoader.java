package com.insightframe.core.loader;

import com.insightframe.api.plugin.Permission;
import com.insightframe.api.plugin.PluginManifest;
import com.insightframe.core.exception.ManifestInvalidException;
import com.insightframe.core.exception.ManifestNotFoundException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * 从插件包中读取 plugin.yml
 * <p>
 * 支持 Jar/Zip 包 (生产) 和解压目录 (开发)。读取成功即完成必填字段校验。
 */
public final class PluginManifestLoader {

    public static final String MANIFEST_NAME = "plugin.yml";

    private PluginManifestLoader() {
    }

    /**
     * 读取并校验插件包内的清单
     *
     * @param source Jar/Zip 文件或包含 plugin.yml 的目录
     * @throws ManifestNotFoundException 缺少 plugin.yml 或包不可读
     * @throws ManifestInvalidException  清单格式或字段错误
     */
    public static PluginManifest load(Path source) {
        String label = source.getFileName() != null ? source.getFileName().toString() : source.toString();
        if (Files.isDirectory(source)) {
            Path yml = source.resolve(MANIFEST_NAME);
            if (!Files.isRegularFile(yml)) {
                throw new ManifestNotFoundException(label);
            }
            try (InputStream in = Files.newInputStream(yml)) {
                return load(in, label);
            } catch (IOException e) {
                throw new ManifestNotFoundException(label, e);
            }
        }

        try (ZipFile zip = new ZipFile(source.toFile())) {
            ZipEntry entry = zip.getEntry(MANIFEST_NAME);
            if (entry == null) {
                throw new ManifestNotFoundException(label);
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return load(in, label);
            }
        } catch (IOException e) {
            throw new ManifestNotFoundException(label, e);
        }
    }

    /**
     * 解析清单文本
     *
     * @param label 来源标识，用于错误信息
     */
    public static PluginManifest load(InputStream inputStream, String label) {
        // SnakeYAML 2.x 建议显式传入 LoaderOptions
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));

        Object root;
        try {
            root = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ManifestInvalidException(label, "malformed YAML", e);
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new ManifestInvalidException(label, "root must be a mapping");
        }

        PluginManifest manifest = PluginManifest.builder()
                .id(string(map, "id"))
                .name(string(map, "name"))
                .version(string(map, "version"))
                .description(string(map, "description"))
                .author(string(map, "author"))
                .permissions(permissions(map, label))
                .entryPoint(string(map, "entryPoint"))
                .dependencies(stringList(map, "dependencies", label))
                .build();
        try {
            manifest.validate();
        } catch (IllegalArgumentException e) {
            throw new ManifestInvalidException(manifest.id() != null ? manifest.id() : label, e.getMessage());
        }
        return manifest;
    }

    private static String string(Map<?, ?> map, String key) {
        Object value = map.get(key);
        // 版本号可能被 YAML 解析成数字，例如 version: 1.0
        return value == null ? null : value.toString().trim();
    }

    private static Set<Permission> permissions(Map<?, ?> map, String label) {
        Set<Permission> permissions = EnumSet.noneOf(Permission.class);
        for (String key : stringList(map, "permissions", label)) {
            try {
                permissions.add(Permission.fromKey(key));
            } catch (IllegalArgumentException e) {
                throw new ManifestInvalidException(label, e.getMessage());
            }
        }
        return permissions;
    }

    private static List<String> stringList(Map<?, ?> map, String key, String label) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ManifestInvalidException(label, "'" + key + "' must be a list");
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) {
                result.add(item.toString().trim());
            }
        }
        return result;
    }
}
