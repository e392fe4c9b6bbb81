package com.insightframe.core.classloader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 插件类加载器
 * 特性：
 * 1. Child-First (优先加载插件内部类)
 * 2. 强制委派白名单 (API 契约只从父加载器取，插件无法覆盖)
 * 3. 资源加载 Child-First (防止读取到宿主的 plugin.yml)
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    // 必须强制走父加载器的包（契约包 + JDK + 日志门面）
    private static final List<String> FORCE_PARENT_PACKAGES = Arrays.asList(
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.w3c.", "org.xml.",
            "com.insightframe.api.", // API 契约必须共享，否则 InsightPlugin 类型不一致
            "org.slf4j.",
            "ch.qos.logback.",
            "org.yaml.snakeyaml."
    );

    @Getter
    private final String pluginId;

    @Getter
    private volatile boolean closed;

    public PluginClassLoader(String pluginId, URL[] urls, ClassLoader parent) {
        super(urls, Objects.requireNonNull(parent, "parent class loader"));
        this.pluginId = pluginId;
    }

    @Override
    public Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        ensureOpen(name);
        // 契约包与 JDK 只认父加载器，插件包内的同名类一律不用
        if (shouldDelegateToParent(name)) {
            return getParent().loadClass(name);
        }
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                c = findLocalClass(name);
            }
            if (c == null) {
                c = getParent().loadClass(name);
            }
            if (resolve) {
                resolveClass(c);
            }
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        if (closed) {
            return null;
        }
        URL local = findResource(name);
        return local != null ? local : getParent().getResource(name);
    }

    /**
     * 插件包内的资源排在前面，重复的 URL 只保留一份；关闭后返回空集合
     */
    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        if (closed) {
            return Collections.emptyEnumeration();
        }
        Set<URL> urls = new LinkedHashSet<>(Collections.list(findResources(name)));
        urls.addAll(Collections.list(getParent().getResources(name)));
        return Collections.enumeration(urls);
    }

    @Override
    public void close() throws IOException {
        closed = true;
        super.close();
        log.debug("[{}] ClassLoader closed", pluginId);
    }

    private void ensureOpen(String name) throws ClassNotFoundException {
        if (closed) {
            throw new ClassNotFoundException("ClassLoader of plugin [" + pluginId + "] is closed: " + name);
        }
    }

    /**
     * 只在插件自身的 URL 中查找，找不到返回 null
     */
    private Class<?> findLocalClass(String name) {
        try {
            return findClass(name);
        } catch (ClassNotFoundException e) {
            log.trace("[{}] {} not in plugin archive, delegating to parent", pluginId, name);
            return null;
        }
    }

    private boolean shouldDelegateToParent(String name) {
        for (String pkg : FORCE_PARENT_PACKAGES) {
            if (name.startsWith(pkg)) {
                return true;
            }
        }
        return false;
    }
}
