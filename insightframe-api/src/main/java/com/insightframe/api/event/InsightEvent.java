package com.insightframe.api.event;

/**
 * 事件标记接口
 */
public interface InsightEvent {
}
