package com.insightframe.core.dispatch;

import java.util.List;

/**
 * 一次分发的结果：成功结果 (注册顺序) + 失败日志
 */
public record DispatchReport<R>(List<R> results, List<CapabilityFailure> failures) {

    public DispatchReport {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public static <R> DispatchReport<R> empty() {
        return new DispatchReport<>(List.of(), List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
