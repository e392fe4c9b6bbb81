package com.insightframe.core.dispatch;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.api.capability.AnalyticsCapability;
import com.insightframe.api.capability.ConversationalCapability;
import com.insightframe.api.capability.PluginCapability;
import com.insightframe.api.capability.VisualizationCapability;
import com.insightframe.api.conversation.ConversationQuery;
import com.insightframe.api.conversation.ConversationResponse;
import com.insightframe.api.visualization.RenderedVisualization;
import com.insightframe.api.visualization.VisualizationContext;
import com.insightframe.core.config.InsightFrameConfig;
import com.insightframe.core.exception.AnalyzerFailedException;
import com.insightframe.core.plugin.CapabilityIndex;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.function.Supplier;

/**
 * 能力分发器
 * 职责：把同一个只读上下文扇出给索引中的每个能力，线程隔离、超时控制、故障隔离
 * <p>
 * 单个能力抛异常或超时只会进入失败日志，不会中断整批调用。
 * 返回结果按注册顺序排列，不代表重要程度。
 */
@Slf4j
public class AnalyticsDispatcher {

    private final Supplier<CapabilityIndex> indexSupplier;
    private final long timeoutMs;
    private final int maxWorkers;

    private static final long NOT_STARTED = Long.MIN_VALUE;

    // 用于生成线程名的计数器
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    public AnalyticsDispatcher(Supplier<CapabilityIndex> indexSupplier, InsightFrameConfig config) {
        this.indexSupplier = indexSupplier;
        this.timeoutMs = config.getAnalyticsTimeoutMs();
        this.maxWorkers = Math.max(1, config.getMaxAnalyticsWorkers());
    }

    /**
     * 执行全部分析能力，只返回成功的结果
     */
    public List<AnalyticsResult> executeAnalytics(AnalyticsContext context) {
        return dispatchAnalytics(context).results();
    }

    public DispatchReport<AnalyticsResult> dispatchAnalytics(AnalyticsContext context) {
        return dispatch("analytics", indexSupplier.get().analytics(), capability -> capability.analyze(context));
    }

    /**
     * 查询全部会话能力，只返回成功的回复
     */
    public List<ConversationResponse> queryConversational(ConversationQuery query) {
        return dispatchConversational(query).results();
    }

    public DispatchReport<ConversationResponse> dispatchConversational(ConversationQuery query) {
        return dispatch("conversational", indexSupplier.get().conversational(), capability -> capability.process(query));
    }

    /**
     * 用全部可视化能力渲染同一份数据
     */
    public List<RenderedVisualization> renderVisualizations(VisualizationContext context) {
        return dispatch("visualization", indexSupplier.get().visualization(), capability -> capability.render(context)).results();
    }

    private <C extends PluginCapability, R> DispatchReport<R> dispatch(String label,
                                                                       List<CapabilityIndex.Entry<C>> entries,
                                                                       Invocation<C, R> invocation) {
        if (entries.isEmpty()) {
            return DispatchReport.empty();
        }

        int n = entries.size();
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        // 线程数按能力数量取，不超过配置上限
        ThreadPoolExecutor workers = newWorkerPool(Math.min(n, maxWorkers));
        CompletionService<R> completion = new ExecutorCompletionService<>(workers);

        // 每个任务的计时从真正开始执行时算起，排队时间不计入
        AtomicLongArray startedAt = new AtomicLongArray(n);
        AtomicLongArray elapsed = new AtomicLongArray(n);
        for (int i = 0; i < n; i++) {
            startedAt.set(i, NOT_STARTED);
            elapsed.set(i, NOT_STARTED);
        }

        List<Future<R>> futures = new ArrayList<>(n);
        Map<Future<R>, Integer> indexOf = new IdentityHashMap<>();
        Object[] outcomes = new Object[n];
        int pending = n;
        try {
            for (int i = 0; i < n; i++) {
                int slot = i;
                C capability = entries.get(i).capability();
                Future<R> future = completion.submit(() -> {
                    long begin = System.nanoTime();
                    startedAt.set(slot, begin);
                    try {
                        return invocation.invoke(capability);
                    } finally {
                        elapsed.set(slot, System.nanoTime() - begin);
                    }
                });
                futures.add(future);
                indexOf.put(future, i);
            }

            while (pending > 0) {
                long now = System.nanoTime();
                long waitNanos = timeoutNanos;
                for (int i = 0; i < n; i++) {
                    long begin = startedAt.get(i);
                    if (outcomes[i] != null || begin == NOT_STARTED || futures.get(i).isDone()) {
                        continue;
                    }
                    long left = begin + timeoutNanos - now;
                    if (left > 0) {
                        waitNanos = Math.min(waitNanos, left);
                        continue;
                    }
                    // 协作式取消：中断工作线程，插件应尽早返回
                    futures.get(i).cancel(true);
                    outcomes[i] = timeout(entries.get(i));
                    pending--;
                    replaceWorker(workers);
                }
                if (pending == 0) {
                    break;
                }

                Future<R> done = completion.poll(waitNanos, TimeUnit.NANOSECONDS);
                if (done == null) {
                    continue;
                }
                int i = indexOf.get(done);
                if (outcomes[i] == null) {
                    outcomes[i] = settle(entries.get(i), done, elapsed.get(i) > timeoutNanos);
                    pending--;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (int i = 0; i < n; i++) {
                if (outcomes[i] == null) {
                    futures.get(i).cancel(true);
                    CapabilityIndex.Entry<C> entry = entries.get(i);
                    outcomes[i] = failure(entry.pluginId(), entry.capability().id(), CapabilityFailure.Reason.ERROR,
                            new AnalyzerFailedException(entry.pluginId(), entry.capability().id(), "dispatch interrupted"));
                }
            }
        } finally {
            // 忽略取消的插件线程为守护线程，不会阻塞宿主
            workers.shutdownNow();
        }

        List<R> results = new ArrayList<>();
        List<CapabilityFailure> failures = new ArrayList<>();
        for (Object outcome : outcomes) {
            if (outcome instanceof CapabilityFailure failure) {
                failures.add(failure);
            } else {
                @SuppressWarnings("unchecked")
                R result = (R) outcome;
                results.add(result);
            }
        }

        if (!failures.isEmpty()) {
            log.warn("{} dispatch finished with {} success(es) and {} failure(s)", label, results.size(), failures.size());
        } else {
            log.debug("{} dispatch finished with {} result(s)", label, results.size());
        }
        return new DispatchReport<>(results, failures);
    }

    /**
     * 解析已完成任务的结果；超出时限才返回的结果同样按超时处理
     */
    private <C extends PluginCapability, R> Object settle(CapabilityIndex.Entry<C> entry, Future<R> done, boolean overran) {
        String pluginId = entry.pluginId();
        String capabilityId = entry.capability().id();
        if (overran) {
            return timeout(entry);
        }
        try {
            R result = done.get();
            if (result == null) {
                return failure(pluginId, capabilityId, CapabilityFailure.Reason.ERROR,
                        new AnalyzerFailedException(pluginId, capabilityId, "returned no result"));
            }
            return result;
        } catch (CancellationException e) {
            return timeout(entry);
        } catch (ExecutionException e) {
            return failure(pluginId, capabilityId, CapabilityFailure.Reason.ERROR,
                    new AnalyzerFailedException(pluginId, capabilityId, e.getCause()));
        } catch (InterruptedException e) {
            // 已完成的 Future 不会阻塞，这里只恢复中断标记
            Thread.currentThread().interrupt();
            return failure(pluginId, capabilityId, CapabilityFailure.Reason.ERROR,
                    new AnalyzerFailedException(pluginId, capabilityId, "dispatch interrupted"));
        }
    }

    private <C extends PluginCapability> CapabilityFailure timeout(CapabilityIndex.Entry<C> entry) {
        String pluginId = entry.pluginId();
        String capabilityId = entry.capability().id();
        return failure(pluginId, capabilityId, CapabilityFailure.Reason.TIMEOUT,
                new AnalyzerFailedException(pluginId, capabilityId, "timed out after " + timeoutMs + "ms"));
    }

    /**
     * 超时的插件可能无视中断继续占用线程，补一个工作线程给排队中的任务
     */
    private void replaceWorker(ThreadPoolExecutor workers) {
        int size = workers.getMaximumPoolSize() + 1;
        workers.setMaximumPoolSize(size);
        workers.setCorePoolSize(size);
    }

    private CapabilityFailure failure(String pluginId, String capabilityId,
                                      CapabilityFailure.Reason reason, AnalyzerFailedException error) {
        if (reason == CapabilityFailure.Reason.TIMEOUT) {
            log.warn("[{}] Capability {} timed out ({}ms), dropped from results", pluginId, capabilityId, timeoutMs);
        } else {
            log.error("[{}] Capability {} failed, dropped from results", pluginId, capabilityId, error.getCause() != null ? error.getCause() : error);
        }
        return new CapabilityFailure(pluginId, capabilityId, reason, error);
    }

    private ThreadPoolExecutor newWorkerPool(int size) {
        return new ThreadPoolExecutor(
                size,
                size,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("insightframe-dispatch-" + threadNumber.getAndIncrement());
                    // 守护线程，忽略中断的插件不会阻止 JVM 退出
                    t.setDaemon(true);
                    return t;
                }
        );
    }

    @FunctionalInterface
    private interface Invocation<C, R> {
        R invoke(C capability) throws Exception;
    }
}
