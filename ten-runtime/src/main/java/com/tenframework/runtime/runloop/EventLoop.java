package com.tenframework.runtime.runloop;

import java.util.function.IntSupplier;

/**
 * 单线程协作式事件循环的契约。
 * 实现必须保证：提交的任务、外部事件源的排水和定时器回调永远不会并发执行。
 */
public interface EventLoop {

    String getName();

    void start();

    /**
     * 提交任务，在循环所属线程上执行。线程安全。
     *
     * @return 循环已关闭时返回 false
     */
    boolean postTask(Runnable task);

    /**
     * 注册外部事件源（例如 Extension Group 的入站消息队列）。
     *
     * @param drainSupplier 每轮调用一次，返回本次处理的事件数
     */
    void registerExternalEventSource(IntSupplier drainSupplier);

    /**
     * 通知循环外部事件源有新事件。线程安全。
     */
    void wakeup();

    /**
     * 注册一次性定时器，只能在循环线程上调用。
     *
     * @return 定时器 ID
     */
    long scheduleTimer(long delayMs, Runnable callback);

    boolean cancelTimer(long timerId);

    boolean isInLoopThread();

    /**
     * 停止循环并等待其线程退出。不能在循环线程上调用。
     */
    void shutdown();
}
