package com.insightframe.api.event;

import lombok.Getter;

import java.io.Serializable;

/**
 * 框架事件基类
 */
@Getter
public abstract class AbstractInsightEvent implements InsightEvent, Serializable {
    private final long timestamp;

    protected AbstractInsightEvent() {
        this.timestamp = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "[timestamp=" + timestamp + "]";
    }
}
