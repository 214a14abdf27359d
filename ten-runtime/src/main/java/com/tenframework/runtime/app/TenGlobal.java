package com.tenframework.runtime.app;

import java.util.ArrayList;
import java.util.List;

import com.tenframework.runtime.common.ShutdownOrderViolationException;
import com.tenframework.runtime.engine.Engine;
import lombok.extern.slf4j.Slf4j;

/**
 * 进程级的全局状态：当前存活的 App 列表。存活的 Engine 由 {@link Engine#liveEngines()} 记录。
 * 只有一把锁，且只在 O(1) 的增删和快照时持有，不会跨越任何阻塞调用。
 */
@Slf4j
public final class TenGlobal {

    private static final Object LOCK = new Object();
    private static final List<App> APPS = new ArrayList<>();
    private static boolean initialized = false;

    private TenGlobal() {
    }

    public static void init() {
        synchronized (LOCK) {
            if (!initialized) {
                initialized = true;
                log.info("TenGlobal 已初始化");
            }
        }
    }

    /**
     * 结束进程级生命周期。
     *
     * @throws ShutdownOrderViolationException 仍有 App 或 Engine 存活
     */
    public static void deinit() {
        synchronized (LOCK) {
            if (!APPS.isEmpty()) {
                throw new ShutdownOrderViolationException(
                        "%d app(s) still alive: %s".formatted(APPS.size(), APPS.stream().map(App::getUri).toList()));
            }
            List<Engine> engines = Engine.liveEngines();
            if (!engines.isEmpty()) {
                throw new ShutdownOrderViolationException("%d engine(s) still alive: %s"
                        .formatted(engines.size(), engines.stream().map(Engine::getGraphId).toList()));
            }
            initialized = false;
        }
        log.info("TenGlobal 已去初始化");
    }

    public static boolean isInitialized() {
        synchronized (LOCK) {
            return initialized;
        }
    }

    /**
     * 当前存活 App 的快照。
     */
    public static List<App> apps() {
        synchronized (LOCK) {
            return List.copyOf(APPS);
        }
    }

    static void addApp(App app) {
        synchronized (LOCK) {
            if (!initialized) {
                // App 可以不经显式 init 直接启动
                initialized = true;
            }
            if (!APPS.contains(app)) {
                APPS.add(app);
            }
        }
    }

    static boolean removeApp(App app) {
        synchronized (LOCK) {
            return APPS.remove(app);
        }
    }
}
