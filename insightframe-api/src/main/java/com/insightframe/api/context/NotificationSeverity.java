package com.insightframe.api.context;

public enum NotificationSeverity {
    INFO,
    WARNING,
    ERROR,
    SUCCESS
}
