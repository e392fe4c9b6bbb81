package com.insightframe.core.plugin;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.api.capability.CapabilityKind;
import com.insightframe.api.capability.PluginCapability;
import com.insightframe.api.conversation.ConversationQuery;
import com.insightframe.api.conversation.ConversationResponse;
import com.insightframe.api.event.lifecycle.PluginInstalledEvent;
import com.insightframe.api.event.lifecycle.PluginLoadedEvent;
import com.insightframe.api.event.lifecycle.PluginUninstalledEvent;
import com.insightframe.api.event.lifecycle.PluginUnloadedEvent;
import com.insightframe.api.plugin.InsightPlugin;
import com.insightframe.api.plugin.PluginInfo;
import com.insightframe.api.plugin.PluginManifest;
import com.insightframe.core.config.InsightFrameConfig;
import com.insightframe.core.context.CorePluginContext;
import com.insightframe.core.dispatch.AnalyticsDispatcher;
import com.insightframe.core.event.EventBus;
import com.insightframe.core.exception.AlreadyLoadedException;
import com.insightframe.core.exception.LoadTimeoutException;
import com.insightframe.core.exception.ManifestInvalidException;
import com.insightframe.core.exception.ManifestNotFoundException;
import com.insightframe.core.exception.NotLoadedException;
import com.insightframe.core.exception.PluginException;
import com.insightframe.core.exception.PluginInitFailedException;
import com.insightframe.core.exception.PluginNotFoundException;
import com.insightframe.core.exception.PluginShutdownFailedException;
import com.insightframe.core.exception.StoreWriteFailedException;
import com.insightframe.core.loader.PluginManifestLoader;
import com.insightframe.core.loader.PluginStore;
import com.insightframe.core.security.PermissionService;
import com.insightframe.core.spi.NotificationChannel;
import com.insightframe.core.spi.PluginLoaderFactory;
import com.insightframe.core.spi.PreferenceStore;
import com.insightframe.core.spi.RecordRepository;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 插件生命周期管理器
 * 职责：
 * 1. 插件的安装与升级 (Install/Upgrade)
 * 2. 插件的卸载 (Uninstall)
 * 3. 加载/卸载与启停 (Load/Unload, Enable/Disable)
 * 4. 能力索引与查询 (Capability Index)
 * 5. 资源的全局管控 (Global Shutdown)
 * <p>
 * 目录的唯一写入方：所有变更经过同一把锁串行执行，
 * 读操作只访问不可变快照，不会阻塞在加载中的插件上。
 */
@Slf4j
public class PluginManager {

    public static final String ENABLED_PREFIX = "plugin_enabled_";

    private final InsightFrameConfig config;
    private final PluginStore store;
    private final PluginLoaderFactory loaderFactory;
    private final PermissionService permissionService;
    private final PreferenceStore preferenceStore;
    private final RecordRepository recordRepository;
    private final NotificationChannel notificationChannel;
    private final EventBus eventBus;

    @Getter
    private final AnalyticsDispatcher dispatcher;

    // 单写者锁
    private final ReentrantLock stateLock = new ReentrantLock();

    // 目录快照：Key=PluginId, 按安装顺序
    private volatile Map<String, PluginInfo> catalogue = Collections.emptyMap();

    // 驻留实例，按加载顺序 (受 stateLock 保护)
    private final Map<String, LoadedPlugin> loaded = new LinkedHashMap<>();

    // 驻留实例快照，供无锁读取
    private volatile Map<String, LoadedPlugin> residentSnapshot = Collections.emptyMap();

    private volatile CapabilityIndex index = CapabilityIndex.EMPTY;

    // 插件包路径，用于 enable 时重新加载 (受 stateLock 保护)
    private final Map<String, Path> pluginSources = new HashMap<>();

    // 内置插件保留的实例 (受 stateLock 保护)
    private final Map<String, InsightPlugin> builtins = new HashMap<>();

    // 生命周期执行器：读清单、initialize、shutdown 都在这里限时执行
    private final ExecutorService lifecycleExecutor;

    private final AtomicInteger threadNumber = new AtomicInteger(1);

    private volatile boolean closed;

    public PluginManager(InsightFrameConfig config,
                         PluginStore store,
                         PluginLoaderFactory loaderFactory,
                         PermissionService permissionService,
                         PreferenceStore preferenceStore,
                         RecordRepository recordRepository,
                         NotificationChannel notificationChannel,
                         EventBus eventBus) {
        this.config = config;
        this.store = store;
        this.loaderFactory = loaderFactory;
        this.permissionService = permissionService;
        this.preferenceStore = preferenceStore;
        this.recordRepository = recordRepository;
        this.notificationChannel = notificationChannel;
        this.eventBus = eventBus;
        this.dispatcher = new AnalyticsDispatcher(() -> index, config);
        this.lifecycleExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("insightframe-lifecycle-" + threadNumber.getAndIncrement());
            // 守护线程，卡死的 initialize 不会阻止 JVM 退出
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("Lifecycle thread {} failed: {}", thread.getName(), e.getMessage(), e));
            return t;
        });
    }

    // ================= 安装 / 卸载 =================

    /**
     * 安装插件包并启用
     * 同 ID 已加载时先卸载旧实例 (原地升级)
     *
     * @param pkg Jar/Zip 包的字节内容，根目录必须包含 plugin.yml
     * @return 已初始化的插件实例
     */
    public InsightPlugin install(byte[] pkg) {
        ensureOpen();
        if (pkg == null || pkg.length == 0) {
            throw new ManifestNotFoundException("package");
        }

        Path staged = stage(pkg);
        try {
            PluginManifest manifest = callWithTimeout("package", () -> PluginManifestLoader.load(staged),
                    cause -> new ManifestNotFoundException("package", cause));
            String pluginId = manifest.id();
            // 校验 ID 可作文件名，失败时仓库和目录都保持原样
            store.pathOf(pluginId);

            stateLock.lock();
            try {
                log.info("[{}] Installing plugin v{}", pluginId, manifest.version());
                if (loaded.containsKey(pluginId)) {
                    log.info("[{}] Upgrading in place, unloading resident instance", pluginId);
                    unloadQuietly(pluginId);
                }

                Path target = store.write(pluginId, staged);
                pluginSources.put(pluginId, target);
                builtins.remove(pluginId);

                putInfo(new PluginInfo(manifest, false, false));
                eventBus.publish(new PluginInstalledEvent(pluginId, manifest.version()));

                return doEnable(pluginId);
            } finally {
                stateLock.unlock();
            }
        } finally {
            try {
                Files.deleteIfExists(staged);
            } catch (IOException e) {
                log.warn("Failed to delete staged package {}: {}", staged, e.getMessage());
            }
        }
    }

    /**
     * 卸载插件：停用、删除仓库中的包、移除开关与目录条目
     * 未知 ID 直接忽略
     */
    public void uninstall(String pluginId) {
        stateLock.lock();
        try {
            PluginInfo info = catalogue.get(pluginId);
            if (info == null) {
                log.debug("[{}] Uninstall ignored, plugin not installed", pluginId);
                return;
            }
            log.info("[{}] Uninstalling plugin", pluginId);

            if (loaded.containsKey(pluginId)) {
                unloadQuietly(pluginId);
            }

            Path source = pluginSources.get(pluginId);
            if (source != null && isStoreManaged(source)) {
                store.delete(pluginId);
            }

            pluginSources.remove(pluginId);
            builtins.remove(pluginId);
            preferenceStore.remove(ENABLED_PREFIX + pluginId);
            permissionService.removePlugin(pluginId);
            removeInfo(pluginId);

            eventBus.publish(new PluginUninstalledEvent(pluginId, info.manifest().version()));
            log.info("[{}] Plugin uninstalled", pluginId);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 注册静态链接的内置插件
     * 与外部插件共享目录和生命周期，没有持久化开关时按配置决定是否启用
     */
    public PluginInfo registerBuiltin(PluginManifest manifest, InsightPlugin plugin) {
        ensureOpen();
        try {
            manifest.validate();
        } catch (IllegalArgumentException e) {
            throw new ManifestInvalidException(String.valueOf(manifest.id()), e.getMessage());
        }
        String pluginId = manifest.id();

        stateLock.lock();
        try {
            if (catalogue.containsKey(pluginId)) {
                throw new ManifestInvalidException(pluginId, "id already installed");
            }
            builtins.put(pluginId, plugin);
            boolean enabled = preferenceStore.getBoolean(ENABLED_PREFIX + pluginId, config.isBuiltinsEnabledByDefault());
            putInfo(new PluginInfo(manifest, enabled, false));
            eventBus.publish(new PluginInstalledEvent(pluginId, manifest.version()));
            log.info("[{}] Builtin plugin registered (enabled={})", pluginId, enabled);

            if (enabled) {
                loadRecordingFailure(pluginId);
            }
            return catalogue.get(pluginId);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 启动扫描：仓库中尚未登记的插件包加入目录，之前已启用的自动加载
     * 单个插件失败只记录到其 lastError，不影响其余插件
     *
     * @return 本次新登记的条目数
     */
    public int scanStore() {
        ensureOpen();
        int registered = 0;
        for (Path archive : store.list()) {
            String fileId = PluginStore.idFromFileName(archive);
            PluginManifest manifest;
            try {
                manifest = callWithTimeout(fileId, () -> PluginManifestLoader.load(archive),
                        cause -> new ManifestNotFoundException(fileId, cause));
            } catch (PluginException e) {
                log.error("[{}] Unreadable plugin package {}: {}", fileId, archive, e.getMessage());
                if (registerBroken(fileId, archive, e.getMessage())) {
                    registered++;
                }
                continue;
            }

            stateLock.lock();
            try {
                String pluginId = manifest.id();
                if (catalogue.containsKey(pluginId)) {
                    log.debug("[{}] Already in catalogue, skipping {}", pluginId, archive);
                    continue;
                }
                pluginSources.put(pluginId, archive);
                boolean enabled = preferenceStore.getBoolean(ENABLED_PREFIX + pluginId, false);
                putInfo(new PluginInfo(manifest, enabled, false));
                registered++;
                log.info("[{}] Discovered plugin v{} (enabled={})", pluginId, manifest.version(), enabled);

                if (enabled) {
                    loadRecordingFailure(pluginId);
                }
            } finally {
                stateLock.unlock();
            }
        }
        return registered;
    }

    // ================= 加载 / 卸载 =================

    /**
     * 从插件包加载插件
     * 加载前把启用开关写为 true 并持久化
     *
     * @throws AlreadyLoadedException     该 ID 已驻留
     * @throws PluginInitFailedException  入口无法解析或 initialize 失败
     * @throws LoadTimeoutException       超过 loadTimeoutMs
     */
    public InsightPlugin load(Path source) {
        ensureOpen();
        String label = source.getFileName() != null ? source.getFileName().toString() : source.toString();
        PluginManifest manifest = callWithTimeout(label, () -> PluginManifestLoader.load(source),
                cause -> new ManifestNotFoundException(label, cause));
        String pluginId = manifest.id();

        stateLock.lock();
        try {
            if (loaded.containsKey(pluginId)) {
                throw new AlreadyLoadedException(pluginId);
            }
            pluginSources.put(pluginId, source);
            builtins.remove(pluginId);
            PluginInfo existing = catalogue.get(pluginId);
            // 显式加载即启用，不存在已加载但停用的状态
            preferenceStore.setBoolean(ENABLED_PREFIX + pluginId, true);
            putInfo(new PluginInfo(manifest, true, false, existing != null ? existing.lastError() : null));
            return doLoad(manifest, source, null);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 卸载驻留实例
     * shutdown 失败时实例仍被移除，随后抛出 {@link PluginShutdownFailedException}
     */
    public void unload(String pluginId) {
        stateLock.lock();
        try {
            doUnload(pluginId);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 启用插件并加载；已加载时只写开关
     */
    public void enable(String pluginId) {
        ensureOpen();
        stateLock.lock();
        try {
            doEnable(pluginId);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 停用插件，结束时必然处于未加载状态
     */
    public void disable(String pluginId) {
        stateLock.lock();
        try {
            PluginInfo info = requireInfo(pluginId);
            preferenceStore.setBoolean(ENABLED_PREFIX + pluginId, false);
            putInfo(info.withEnabled(false));
            if (loaded.containsKey(pluginId)) {
                doUnload(pluginId);
            }
            log.info("[{}] Plugin disabled", pluginId);
        } finally {
            stateLock.unlock();
        }
    }

    // ================= 查询 =================

    /**
     * 按种类返回已加载插件的全部能力 (加载顺序)
     */
    public List<PluginCapability> getCapabilities(CapabilityKind kind) {
        return index.of(kind);
    }

    public CapabilityIndex getCapabilityIndex() {
        return index;
    }

    public List<AnalyticsResult> executeAnalytics(AnalyticsContext context) {
        return dispatcher.executeAnalytics(context);
    }

    public List<ConversationResponse> queryConversational(ConversationQuery query) {
        return dispatcher.queryConversational(query);
    }

    public List<PluginInfo> getInstalledPlugins() {
        return List.copyOf(catalogue.values());
    }

    public Optional<PluginInfo> getPluginInfo(String pluginId) {
        return Optional.ofNullable(catalogue.get(pluginId));
    }

    public List<PluginInfo> getLoadedPlugins() {
        List<PluginInfo> result = new ArrayList<>();
        Map<String, PluginInfo> snapshot = catalogue;
        for (String pluginId : residentSnapshot.keySet()) {
            PluginInfo info = snapshot.get(pluginId);
            if (info != null) {
                result.add(info);
            }
        }
        return result;
    }

    public Optional<InsightPlugin> getPlugin(String pluginId) {
        LoadedPlugin resident = residentSnapshot.get(pluginId);
        return resident == null ? Optional.empty() : Optional.of(resident.plugin());
    }

    public boolean isLoaded(String pluginId) {
        return residentSnapshot.containsKey(pluginId);
    }

    // ================= 全局关闭 =================

    /**
     * 按加载的逆序卸载全部插件并停止执行器
     */
    public void shutdown() {
        stateLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            log.info("Shutting down plugin manager, {} plugin(s) resident", loaded.size());
            List<String> ids = new ArrayList<>(loaded.keySet());
            Collections.reverse(ids);
            for (String pluginId : ids) {
                unloadQuietly(pluginId);
            }
            lifecycleExecutor.shutdownNow();
        } finally {
            stateLock.unlock();
        }
    }

    // ================= 内部实现 (调用方持有 stateLock) =================

    private InsightPlugin doEnable(String pluginId) {
        PluginInfo info = requireInfo(pluginId);
        preferenceStore.setBoolean(ENABLED_PREFIX + pluginId, true);
        putInfo(info.withEnabled(true));

        LoadedPlugin resident = loaded.get(pluginId);
        if (resident != null) {
            log.debug("[{}] Already loaded, enable only persisted the flag", pluginId);
            return resident.plugin();
        }
        InsightPlugin plugin = loadById(pluginId);
        log.info("[{}] Plugin enabled", pluginId);
        return plugin;
    }

    private InsightPlugin loadById(String pluginId) {
        PluginManifest manifest = requireInfo(pluginId).manifest();
        InsightPlugin builtin = builtins.get(pluginId);
        if (builtin != null) {
            return doLoad(manifest, null, builtin);
        }
        Path source = pluginSources.get(pluginId);
        if (source == null) {
            source = store.pathOf(pluginId);
        }
        return doLoad(manifest, source, null);
    }

    private void loadRecordingFailure(String pluginId) {
        try {
            loadById(pluginId);
        } catch (PluginException e) {
            // 失败原因已记录在 lastError 中
            log.error("[{}] Auto-load failed: {}", pluginId, e.getMessage());
        }
    }

    /**
     * @param source  插件包；内置插件为 null
     * @param builtin 内置插件保留的实例；外部插件为 null
     */
    private InsightPlugin doLoad(PluginManifest manifest, Path source, InsightPlugin builtin) {
        String pluginId = manifest.id();
        if (loaded.containsKey(pluginId)) {
            throw new AlreadyLoadedException(pluginId);
        }
        log.info("[{}] Loading plugin v{}", pluginId, manifest.version());

        ClassLoader classLoader = null;
        try {
            if (builtin == null) {
                classLoader = loaderFactory.create(pluginId, source, getClass().getClassLoader());
            }
            permissionService.grant(pluginId, manifest.permissions());
            CorePluginContext context = new CorePluginContext(manifest, permissionService,
                    recordRepository, notificationChannel, preferenceStore, eventBus);

            ClassLoader pluginLoader = classLoader;
            LoadedPlugin resident = callWithTimeout(pluginId,
                    () -> initialize(manifest, pluginLoader, builtin, context),
                    cause -> new PluginInitFailedException(pluginId, cause));

            loaded.put(pluginId, resident);
            refreshIndex();
            putInfo(requireInfo(pluginId).withLoaded(true));

            eventBus.publish(new PluginLoadedEvent(pluginId, manifest.version()));
            log.info("[{}] Plugin loaded with {} capability(ies)", pluginId, resident.capabilities().size());
            return resident.plugin();
        } catch (PluginException e) {
            abortLoad(manifest, classLoader, e);
            throw e;
        } catch (RuntimeException e) {
            PluginInitFailedException failure = new PluginInitFailedException(pluginId, e);
            abortLoad(manifest, classLoader, failure);
            throw failure;
        }
    }

    private LoadedPlugin initialize(PluginManifest manifest, ClassLoader classLoader,
                                    InsightPlugin builtin, CorePluginContext context) throws Exception {
        InsightPlugin plugin = builtin != null ? builtin : instantiate(manifest, classLoader);

        // 初始化期间切换 TCCL，插件内的 SPI/反射按插件自己的加载器查找
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        if (classLoader != null) {
            thread.setContextClassLoader(classLoader);
        }
        try {
            plugin.initialize(context);
            List<PluginCapability> capabilities = plugin.getCapabilities();
            return new LoadedPlugin(manifest, plugin, classLoader, capabilities);
        } finally {
            thread.setContextClassLoader(previous);
        }
    }

    private InsightPlugin instantiate(PluginManifest manifest, ClassLoader classLoader) throws Exception {
        String pluginId = manifest.id();
        String entryPoint = manifest.entryPoint();
        Class<?> clazz;
        try {
            clazz = Class.forName(entryPoint, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new PluginInitFailedException(pluginId, "entry point class not found: " + entryPoint);
        }
        if (!InsightPlugin.class.isAssignableFrom(clazz)) {
            throw new PluginInitFailedException(pluginId,
                    "entry point " + entryPoint + " does not implement " + InsightPlugin.class.getName());
        }
        try {
            return (InsightPlugin) clazz.getDeclaredConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            throw new PluginInitFailedException(pluginId, "entry point " + entryPoint + " has no public no-arg constructor");
        }
    }

    private void abortLoad(PluginManifest manifest, ClassLoader classLoader, PluginException failure) {
        String pluginId = manifest.id();
        closeClassLoader(pluginId, classLoader);
        permissionService.removePlugin(pluginId);
        eventBus.unsubscribeAll(pluginId);

        PluginInfo info = catalogue.get(pluginId);
        putInfo(info != null
                ? info.withError(failure.getMessage())
                : new PluginInfo(manifest, false, false, failure.getMessage()));
        log.error("[{}] Load failed: {}", pluginId, failure.getMessage(), failure.getCause());
    }

    private void doUnload(String pluginId) {
        LoadedPlugin resident = loaded.remove(pluginId);
        if (resident == null) {
            throw new NotLoadedException(pluginId);
        }
        // 先摘除能力，新的分发不会再路由到该插件
        refreshIndex();
        log.info("[{}] Unloading plugin", pluginId);

        PluginShutdownFailedException failure = null;
        try {
            callWithTimeout(pluginId, () -> {
                resident.plugin().shutdown();
                return null;
            }, cause -> new PluginShutdownFailedException(pluginId, cause));
        } catch (PluginShutdownFailedException e) {
            failure = e;
        } catch (PluginException e) {
            failure = new PluginShutdownFailedException(pluginId, e);
        }

        closeClassLoader(pluginId, resident.classLoader());
        permissionService.removePlugin(pluginId);
        eventBus.unsubscribeAll(pluginId);

        PluginInfo info = catalogue.get(pluginId);
        if (info != null) {
            putInfo(failure == null ? info.withLoaded(false) : info.withError(failure.getMessage()));
        }
        eventBus.publish(new PluginUnloadedEvent(pluginId, resident.manifest().version()));

        if (failure != null) {
            log.error("[{}] Shutdown failed, instance removed anyway", pluginId, failure.getCause());
            throw failure;
        }
        log.info("[{}] Plugin unloaded", pluginId);
    }

    private void unloadQuietly(String pluginId) {
        try {
            doUnload(pluginId);
        } catch (PluginShutdownFailedException e) {
            log.warn("[{}] Continuing after shutdown failure: {}", pluginId, e.getMessage());
        }
    }

    private boolean registerBroken(String fileId, Path archive, String error) {
        stateLock.lock();
        try {
            if (catalogue.containsKey(fileId)) {
                return false;
            }
            PluginManifest placeholder = PluginManifest.builder()
                    .id(fileId)
                    .name(fileId)
                    .version("unknown")
                    .entryPoint("unknown")
                    .build();
            pluginSources.put(fileId, archive);
            putInfo(new PluginInfo(placeholder, false, false, error));
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * 在生命周期线程上限时执行
     *
     * @param wrap 把非 PluginException 的失败原因包装成对应的异常类型
     */
    private <T> T callWithTimeout(String pluginId, Callable<T> task, Function<Throwable, PluginException> wrap) {
        long timeoutMs = config.getLoadTimeoutMs();
        Future<T> future = lifecycleExecutor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LoadTimeoutException(pluginId, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PluginException pluginException) {
                throw pluginException;
            }
            throw wrap.apply(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw wrap.apply(e);
        }
    }

    private void closeClassLoader(String pluginId, ClassLoader classLoader) {
        if (classLoader instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.warn("[{}] Failed to close class loader: {}", pluginId, e.getMessage());
            }
        }
    }

    private Path stage(byte[] pkg) {
        try {
            Path staged = Files.createTempFile("insightframe-", PluginStore.EXTENSION);
            Files.write(staged, pkg);
            return staged;
        } catch (IOException e) {
            throw new StoreWriteFailedException("package", "stage", e);
        }
    }

    private boolean isStoreManaged(Path source) {
        Path parent = source.toAbsolutePath().normalize().getParent();
        return parent != null && parent.equals(store.getDirectory().toAbsolutePath().normalize());
    }

    private PluginInfo requireInfo(String pluginId) {
        PluginInfo info = catalogue.get(pluginId);
        if (info == null) {
            throw new PluginNotFoundException(pluginId);
        }
        return info;
    }

    private void putInfo(PluginInfo info) {
        Map<String, PluginInfo> next = new LinkedHashMap<>(catalogue);
        next.put(info.id(), info);
        catalogue = Collections.unmodifiableMap(next);
    }

    private void removeInfo(String pluginId) {
        Map<String, PluginInfo> next = new LinkedHashMap<>(catalogue);
        next.remove(pluginId);
        catalogue = Collections.unmodifiableMap(next);
    }

    private void refreshIndex() {
        residentSnapshot = Collections.unmodifiableMap(new LinkedHashMap<>(loaded));
        index = CapabilityIndex.build(loaded.values());
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PluginManager has been shut down");
        }
    }
}
