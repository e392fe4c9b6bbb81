package com.insightframe.runtime.host;

import com.insightframe.api.exception.InsightFrameException;
import com.insightframe.core.spi.PreferenceStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

/**
 * 基于 properties 文件的偏好存储
 * <p>
 * 启动时读取一次，之后每次写入整体落盘 (先写临时文件再替换)。
 * 写入串行化，读取走内存。
 */
@Slf4j
public class PropertiesPreferenceStore implements PreferenceStore {

    @Getter
    private final Path file;

    private final Properties properties = new Properties();

    public PropertiesPreferenceStore(Path file) {
        this.file = file;
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                properties.load(in);
                log.info("Loaded {} preference(s) from {}", properties.size(), file.toAbsolutePath());
            } catch (IOException e) {
                throw new InsightFrameException("Failed to read preferences from " + file, e);
            }
        }
    }

    @Override
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    @Override
    public synchronized void setString(String key, String value) {
        if (value == null) {
            properties.remove(key);
        } else {
            properties.setProperty(key, value);
        }
        persist();
    }

    @Override
    public synchronized void remove(String key) {
        if (properties.remove(key) != null) {
            persist();
        }
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                properties.store(out, "InsightFrame preferences");
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new InsightFrameException("Failed to persist preferences to " + file, e);
        }
    }
}
