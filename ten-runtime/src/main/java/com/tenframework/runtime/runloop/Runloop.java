package com.tenframework.runtime.runloop;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.function.IntSupplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.agrona.DeadlineTimerWheel;
import org.agrona.collections.Long2ObjectHashMap;
import org.agrona.concurrent.Agent;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.AgentTerminationException;
import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.ManyToOneConcurrentLinkedQueue;

/**
 * Runloop 类负责线程管理和任务调度，对齐 C 语言的 ten_runloop。
 * 基于 Agrona AgentRunner 实现单线程事件循环，处理内部任务、外部事件源和定时器。
 *
 * 主要设计点：
 * 1. 批量消费内部任务，避免每次只处理一个任务造成延迟。
 * 2. 使用 BackoffIdleStrategy 作自旋->yield->sleep 折中。
 * 3. 提交任务时 unpark 核心线程。
 * 4. 定时器由 DeadlineTimerWheel 驱动，只在核心线程上访问。
 */
@Slf4j
public class Runloop implements EventLoop {

    private static final int DEFAULT_INTERNAL_TASK_BATCH = 64;
    private static final int TIMER_TICKS_PER_WHEEL = 512;
    private static final int TIMER_EXPIRY_LIMIT = 64;
    private static final long JOIN_TIMEOUT_MS = 3000;

    @Getter
    private final String name;
    // 无界队列：停止阶段的 Aborted 结果绝不能因队列满而丢失
    private final ManyToOneConcurrentLinkedQueue<Runnable> taskQueue;
    private final RunloopAgent coreAgent;
    private final int internalTaskBatchSize;
    private final DeadlineTimerWheel timerWheel;
    private final Long2ObjectHashMap<Runnable> timerCallbacks;
    private AgentRunner agentRunner;
    private volatile boolean running = false;
    private volatile boolean closed = false;
    @Getter
    private volatile Thread coreThread;
    private volatile IntSupplier externalEventDrainSupplier;

    public Runloop(String name) {
        this(name, DEFAULT_INTERNAL_TASK_BATCH);
    }

    /**
     * @param name                  名称（用于线程名）
     * @param internalTaskBatchSize 每轮最多处理多少个内部任务
     */
    public Runloop(String name, int internalTaskBatchSize) {
        this.name = Objects.requireNonNull(name, "name");
        this.taskQueue = new ManyToOneConcurrentLinkedQueue<>();
        this.internalTaskBatchSize = Math.max(1, internalTaskBatchSize);
        this.coreAgent = new RunloopAgent();
        this.timerWheel = new DeadlineTimerWheel(TimeUnit.MILLISECONDS, System.currentTimeMillis(), 1,
                TIMER_TICKS_PER_WHEEL);
        this.timerCallbacks = new Long2ObjectHashMap<>();
    }

    @Override
    public void registerExternalEventSource(IntSupplier drainSupplier) {
        externalEventDrainSupplier = drainSupplier;
        log.debug("Runloop {}: 外部事件源已注册。", name);
    }

    @Override
    public void start() {
        if (running || closed) {
            log.warn("Runloop {} already started or closed.", name);
            return;
        }
        running = true;

        IdleStrategy idleStrategy = new BackoffIdleStrategy(
                1, // maxSpins
                1, // maxYields
                TimeUnit.NANOSECONDS.toNanos(50), // minParkPeriodNs
                TimeUnit.MICROSECONDS.toNanos(100) // maxParkPeriodNs
        );

        agentRunner = new AgentRunner(
                idleStrategy,
                throwable -> {
                    if (!(throwable instanceof AgentTerminationException)) {
                        log.error("Runloop {} AgentRunner 发生未捕获异常", name, throwable);
                    }
                },
                null,
                coreAgent);

        Thread agentThread = new Thread(agentRunner, coreAgent.roleName());
        agentThread.setDaemon(false);
        agentThread.setUncaughtExceptionHandler((thread, ex) -> log.error("Runloop {} 线程发生未捕获异常", name, ex));
        coreThread = agentThread;
        agentThread.start();

        log.info("Runloop started. Thread: {}", agentThread.getName());
    }

    /**
     * 提交一个任务到 Runloop 内部队列中（会在 Runloop 专属线程上执行）。
     * 启动之前提交的任务会在线程启动后最先执行。
     */
    @Override
    public boolean postTask(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        if (closed) {
            log.warn("Runloop {} is closed, task will not be executed.", name);
            return false;
        }
        taskQueue.offer(task);
        wakeup();
        return true;
    }

    @Override
    public void wakeup() {
        Thread t = coreThread;
        if (t != null) {
            LockSupport.unpark(t);
        }
    }

    @Override
    public long scheduleTimer(long delayMs, Runnable callback) {
        checkLoopThread();
        long timerId = timerWheel.scheduleTimer(System.currentTimeMillis() + Math.max(0, delayMs));
        timerCallbacks.put(timerId, callback);
        return timerId;
    }

    @Override
    public boolean cancelTimer(long timerId) {
        checkLoopThread();
        timerCallbacks.remove(timerId);
        return timerWheel.cancelTimer(timerId);
    }

    @Override
    public boolean isInLoopThread() {
        return Thread.currentThread() == coreThread;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 关闭 Runloop 并等待线程退出。
     * 如果某个任务或外部事件处理器一直阻塞，最多等待 {@value #JOIN_TIMEOUT_MS} 毫秒后中断线程并返回，
     * 不会无限期卡住调用方。
     */
    @Override
    public void shutdown() {
        if (isInLoopThread()) {
            throw new IllegalStateException("Runloop %s 不能在自身线程上关闭".formatted(name));
        }
        if (closed) {
            log.debug("Runloop {} is already closed.", name);
            return;
        }
        closed = true;
        if (!running) {
            drainTaskQueue();
            return;
        }
        running = false;
        wakeup();

        Thread t = coreThread;
        try {
            if (t != null) {
                t.join(JOIN_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Runloop {} shutdown interrupted.", name);
            return;
        }

        if (t != null && t.isAlive()) {
            log.warn("Runloop {} 线程在 {}ms 内未退出，发送中断后放弃等待", name, JOIN_TIMEOUT_MS);
            t.interrupt();
            return;
        }
        agentRunner.close();
        log.info("Runloop {} shutdown completed.", name);
    }

    private void checkLoopThread() {
        if (coreThread != null && !isInLoopThread()) {
            throw new IllegalStateException("定时器只能在 Runloop %s 的线程上操作".formatted(name));
        }
    }

    private void drainTaskQueue() {
        // ManyToOneConcurrentLinkedQueue 不支持 clear()
        while (taskQueue.poll() != null) {
            // discard
        }
    }

    private boolean onTimerExpiry(TimeUnit timeUnit, long now, long timerId) {
        Runnable callback = timerCallbacks.remove(timerId);
        if (callback != null) {
            try {
                callback.run();
            } catch (Throwable e) {
                log.error("Runloop {}: 定时器回调发生异常", name, e);
            }
        }
        return true;
    }

    /**
     * Runloop 的核心 Agent 实现。
     * 负责在一个线程上轮询内部任务、外部事件和定时器。
     */
    private class RunloopAgent implements Agent {

        @Override
        public String roleName() {
            return "ten-runloop-" + name;
        }

        @Override
        public int doWork() {
            if (!running) {
                throw new AgentTerminationException();
            }
            int workDone = 0;

            Runnable r;
            while (workDone < internalTaskBatchSize && (r = taskQueue.poll()) != null) {
                try {
                    r.run();
                } catch (Throwable e) {
                    log.error("Runloop {}: 执行内部任务发生异常", name, e);
                }
                workDone++;
            }

            IntSupplier drain = externalEventDrainSupplier;
            if (drain != null) {
                try {
                    workDone += Math.max(0, drain.getAsInt());
                } catch (Throwable e) {
                    log.error("Runloop {}: 执行外部事件处理器发生异常", name, e);
                }
            }

            long now = System.currentTimeMillis();
            int rounds = 0;
            // 每次 poll 只推进一个 tick，落后时多推进几次
            do {
                workDone += timerWheel.poll(now, Runloop.this::onTimerExpiry, TIMER_EXPIRY_LIMIT);
            } while (timerWheel.currentTickTime() <= now && ++rounds < TIMER_EXPIRY_LIMIT);

            return workDone;
        }

        @Override
        public void onStart() {
            log.debug("{} started.", roleName());
        }

        @Override
        public void onClose() {
            log.debug("{} closed.", roleName());
            drainTaskQueue();
        }
    }
}
