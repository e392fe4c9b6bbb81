package com.insightframe.core.event;

import com.insightframe.api.event.InsightEvent;
import com.insightframe.api.event.InsightEventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 宿主事件总线
 * <p>
 * 特点：
 * - 同步派发（保证顺序）
 * - 按事件类型及其父类型匹配
 * - 监听器异常只记录日志，不影响其他监听器和发布方
 */
@Slf4j
public class EventBus {

    private final List<Registration<?>> listeners = new CopyOnWriteArrayList<>();

    /**
     * 订阅事件
     *
     * @param ownerId 订阅方标识 (插件ID或宿主)，用于批量清理
     */
    public <E extends InsightEvent> Subscription subscribe(String ownerId, Class<E> eventType, InsightEventListener<E> listener) {
        Registration<E> registration = new Registration<>(ownerId, eventType, listener);
        listeners.add(registration);
        log.debug("[{}] Subscribed to {}", ownerId, eventType.getSimpleName());
        return () -> listeners.remove(registration);
    }

    @SuppressWarnings("unchecked")
    public void publish(InsightEvent event) {
        log.debug("Publishing event: {}", event);
        for (Registration<?> registration : listeners) {
            if (registration.eventType().isInstance(event)) {
                try {
                    ((Registration<InsightEvent>) registration).listener().onEvent(event);
                } catch (Exception e) {
                    log.error("[{}] Error handling event {}: {}",
                            registration.ownerId(), event.getClass().getSimpleName(), e.getMessage(), e);
                }
            }
        }
    }

    /**
     * 清除某个订阅方的全部订阅
     */
    public void unsubscribeAll(String ownerId) {
        listeners.removeIf(registration -> registration.ownerId().equals(ownerId));
    }

    public int getSubscriptionCount() {
        return listeners.size();
    }

    /**
     * 订阅句柄（用于取消订阅）
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Registration<E extends InsightEvent>(
            String ownerId,
            Class<E> eventType,
            InsightEventListener<E> listener
    ) {
    }
}
