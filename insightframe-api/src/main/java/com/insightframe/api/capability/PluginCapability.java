package com.insightframe.api.capability;

/**
 * 插件能力
 * <p>
 * 封闭的三种变体，每种包装一个不同签名的函数。
 * 一个插件可以暴露任意数量、任意种类的能力。
 * </p>
 */
public sealed interface PluginCapability
        permits AnalyticsCapability, VisualizationCapability, ConversationalCapability {

    String id();

    String name();

    String description();

    CapabilityKind kind();
}
