package com.tenframework.runtime.extension;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import com.tenframework.runtime.runloop.EventLoop;
import lombok.extern.slf4j.Slf4j;

/**
 * TenEnv 的线程安全代理。其他线程不能直接调用 TenEnv，只能通过 {@link #notify(Consumer)}
 * 把闭包投递回所属的分组线程执行。
 * <p>
 * 代理带引用计数：{@link #acquire()} 加一，{@link #release()} 减一，
 * 最后一次释放会作为任务送回所属线程处理，而不是在调用线程上执行。
 */
@Slf4j
public final class TenEnvProxy {

    private final ExtensionEnv env;
    private final EventLoop eventLoop;
    private final AtomicInteger refCount = new AtomicInteger(1);

    TenEnvProxy(ExtensionEnv env, EventLoop eventLoop) {
        this.env = env;
        this.eventLoop = eventLoop;
    }

    /**
     * 在所属线程上执行 action。
     *
     * @return 分组已关闭时返回 false
     */
    public boolean notify(Consumer<TenEnv> action) {
        Objects.requireNonNull(action, "action");
        if (refCount.get() <= 0) {
            throw new IllegalStateException("TenEnvProxy already released");
        }
        return eventLoop.postTask(() -> {
            if (env.isClosed()) {
                log.warn("TenEnvProxy: {} 已关闭，忽略投递的任务", env.getExtensionName());
                return;
            }
            try {
                action.accept(env);
            } catch (Exception e) {
                log.error("TenEnvProxy: {} 执行投递的任务时发生异常", env.getExtensionName(), e);
            }
        });
    }

    public TenEnvProxy acquire() {
        int current;
        do {
            current = refCount.get();
            if (current <= 0) {
                throw new IllegalStateException("TenEnvProxy already released");
            }
        } while (!refCount.compareAndSet(current, current + 1));
        return this;
    }

    public void release() {
        int remaining = refCount.decrementAndGet();
        if (remaining == 0) {
            if (!eventLoop.postTask(env::onProxyReleased)) {
                log.debug("TenEnvProxy: {} 的事件循环已关闭", env.getExtensionName());
            }
        } else if (remaining < 0) {
            refCount.set(0);
            throw new IllegalStateException("TenEnvProxy released more times than acquired");
        }
    }

    public boolean isReleased() {
        return refCount.get() <= 0;
    }
}
