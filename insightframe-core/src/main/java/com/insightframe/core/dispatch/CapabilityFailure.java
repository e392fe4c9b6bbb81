package com.insightframe.core.dispatch;

import com.insightframe.core.exception.AnalyzerFailedException;

/**
 * 分发失败记录
 *
 * @param reason 失败类型
 * @param error  失败详情，原始异常在 cause 中
 */
public record CapabilityFailure(String pluginId, String capabilityId, Reason reason, AnalyzerFailedException error) {

    public enum Reason {
        /**
         * 调用抛出异常或返回空结果
         */
        ERROR,
        /**
         * 超过单次调用时限，任务已被取消
         */
        TIMEOUT
    }

    public String message() {
        return error.getMessage();
    }
}
