package com.insightframe.core.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * InsightFrame Core 全局配置对象 (Immutable)
 * <p>
 * 职责：作为 Core 层的唯一配置入口，屏蔽宿主环境的差异。
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class InsightFrameConfig {

    private static volatile InsightFrameConfig INSTANCE;

    /**
     * 获取全局配置实例
     */
    public static InsightFrameConfig current() {
        InsightFrameConfig config = INSTANCE;
        if (config == null) {
            // 兜底：未初始化时（比如单元测试）返回默认值
            return InsightFrameConfig.builder().build();
        }
        return config;
    }

    /**
     * 初始化全局实例 (由启动器调用一次)
     */
    public static void init(InsightFrameConfig config) {
        INSTANCE = config;
    }

    /**
     * 清理全局配置
     * 场景：单元测试 teardown
     */
    public static void clear() {
        INSTANCE = null;
    }

    /**
     * 插件仓库目录，每个已安装插件一个 {@code <id>.jar}
     */
    @Builder.Default
    private String pluginHome = "plugins";

    /**
     * 启动时是否扫描仓库并自动加载已启用的插件
     */
    @Builder.Default
    private boolean autoScan = true;

    /**
     * 读取插件包、解析入口及 initialize/shutdown 的时限
     */
    @Builder.Default
    private long loadTimeoutMs = 5000L;

    /**
     * 单个分析能力调用的时限，超时按失败处理
     */
    @Builder.Default
    private long analyticsTimeoutMs = 3000L;

    /**
     * 分发线程池上限 (实际大小取能力数与此值的较小者)
     */
    @Builder.Default
    private int maxAnalyticsWorkers = Math.max(2, Runtime.getRuntime().availableProcessors());

    /**
     * 是否在上下文接口边界强制校验清单权限
     * false 时只记录审计日志
     */
    @Builder.Default
    private boolean enforcePermissions = true;

    /**
     * 内置插件在没有持久化开关时是否默认启用
     */
    @Builder.Default
    private boolean builtinsEnabledByDefault = true;

    /**
     * 偏好持久化文件 (Native 启动器使用)，为空时只保存在内存中
     */
    @Builder.Default
    private String preferencesFile = "insightframe.properties";
}
