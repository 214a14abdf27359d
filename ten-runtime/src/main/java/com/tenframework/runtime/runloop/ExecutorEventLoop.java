package com.tenframework.runtime.runloop;

import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 把事件循环委托给外部运行时（例如外语言绑定自带的任务执行器）的适配器。
 * 它不拥有线程：每次有工作时向执行器提交一次“泵”，同一时刻最多只有一个泵在运行，
 * 因此仍然满足单队列、组内无并发的约束。
 */
@Slf4j
public class ExecutorEventLoop implements EventLoop {

    private static final int DEFAULT_TASK_BATCH = 64;

    @Getter
    private final String name;
    private final Executor executor;
    private final ScheduledExecutorService timerService;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean pumpScheduled = new AtomicBoolean(false);
    private final AtomicBoolean pendingWakeup = new AtomicBoolean(false);
    private final AtomicLong timerIds = new AtomicLong(1);
    private final Set<Long> liveTimers = ConcurrentHashMap.newKeySet();
    private final Map<Long, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private volatile IntSupplier externalEventDrainSupplier;
    private volatile Thread loopThread;
    private volatile boolean started = false;
    private volatile boolean closed = false;

    public ExecutorEventLoop(String name, Executor executor) {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timerService = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ten-loop-timer-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void start() {
        started = true;
        log.info("ExecutorEventLoop {} started.", name);
        schedulePump();
    }

    @Override
    public boolean postTask(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        if (closed) {
            log.warn("ExecutorEventLoop {} is closed, task will not be executed.", name);
            return false;
        }
        tasks.offer(task);
        schedulePump();
        return true;
    }

    @Override
    public void registerExternalEventSource(IntSupplier drainSupplier) {
        externalEventDrainSupplier = drainSupplier;
    }

    @Override
    public void wakeup() {
        pendingWakeup.set(true);
        schedulePump();
    }

    @Override
    public long scheduleTimer(long delayMs, Runnable callback) {
        long timerId = timerIds.getAndIncrement();
        // 先登记再调度，0 延迟的定时器也不会丢
        liveTimers.add(timerId);
        ScheduledFuture<?> future = timerService.schedule(() -> {
            timers.remove(timerId);
            if (liveTimers.remove(timerId)) {
                postTask(callback);
            }
        }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        if (liveTimers.contains(timerId)) {
            timers.put(timerId, future);
        }
        return timerId;
    }

    @Override
    public boolean cancelTimer(long timerId) {
        boolean live = liveTimers.remove(timerId);
        ScheduledFuture<?> future = timers.remove(timerId);
        if (future != null) {
            future.cancel(false);
        }
        return live;
    }

    @Override
    public boolean isInLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        liveTimers.clear();
        timers.values().forEach(f -> f.cancel(false));
        timers.clear();
        timerService.shutdownNow();
        log.info("ExecutorEventLoop {} shutdown completed.", name);
    }

    private void schedulePump() {
        if (!started || closed) {
            return;
        }
        if (pumpScheduled.compareAndSet(false, true)) {
            try {
                executor.execute(this::pump);
            } catch (RejectedExecutionException e) {
                pumpScheduled.set(false);
                log.error("ExecutorEventLoop {}: 外部执行器拒绝了任务", name, e);
            }
        }
    }

    private void pump() {
        loopThread = Thread.currentThread();
        int workDone = 0;
        try {
            pendingWakeup.set(false);
            Runnable task;
            while (workDone < DEFAULT_TASK_BATCH && (task = tasks.poll()) != null) {
                try {
                    task.run();
                } catch (Throwable e) {
                    log.error("ExecutorEventLoop {}: 执行任务发生异常", name, e);
                }
                workDone++;
            }
            IntSupplier drain = externalEventDrainSupplier;
            if (drain != null) {
                try {
                    workDone += Math.max(0, drain.getAsInt());
                } catch (Throwable e) {
                    log.error("ExecutorEventLoop {}: 执行外部事件处理器发生异常", name, e);
                }
            }
        } finally {
            loopThread = null;
            pumpScheduled.set(false);
        }
        if (!tasks.isEmpty() || pendingWakeup.get() || workDone > 0) {
            schedulePump();
        }
    }
}
