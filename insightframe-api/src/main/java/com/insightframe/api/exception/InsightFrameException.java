package com.insightframe.api.exception;

/**
 * InsightFrame 基础异常
 */
public class InsightFrameException extends RuntimeException {

    public InsightFrameException(String message) {
        super(message);
    }

    public InsightFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
