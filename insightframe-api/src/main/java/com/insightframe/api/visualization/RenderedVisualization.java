package com.insightframe.api.visualization;

/**
 * 渲染产物，由宿主 UI 按 mediaType 解释
 */
public record RenderedVisualization(String mediaType, String body) {

    public static final String TEXT_PLAIN = "text/plain";
}
