package com.tenframework.runtime.app;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.tenframework.runtime.addon.AddonInstance;
import com.tenframework.runtime.addon.AddonKind;
import com.tenframework.runtime.addon.AddonLoader;
import com.tenframework.runtime.addon.AddonRegistry;
import com.tenframework.runtime.addon.ServiceLoaderAddonLoader;
import com.tenframework.runtime.common.TenErrorCode;
import com.tenframework.runtime.common.TenException;
import com.tenframework.runtime.engine.Engine;
import com.tenframework.runtime.engine.EngineOwner;
import com.tenframework.runtime.graph.GraphDefinition;
import com.tenframework.runtime.runloop.Runloop;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * App 类是整个运行时的顶层容器，持有 Addon 注册表和所有运行中的 Engine。
 * 对应 C 语言中的 ten_app_t。
 * <p>
 * App 有自己的 Runloop，用于处理图内部发来的 stop_graph / close_app 请求，
 * 这些请求不会在 Extension 线程上同步执行。
 */
@Slf4j
public class App implements EngineOwner {

    @Getter
    private final String uri;
    @Getter
    private final AppConfig config;
    @Getter
    private final AddonRegistry registry;
    private final Map<String, Engine> engines = new ConcurrentHashMap<>();
    private final Runloop appRunloop;
    private final CompletableFuture<Void> closedFuture = new CompletableFuture<>();
    private volatile boolean started = false;
    private volatile boolean closed = false;

    public App(AppConfig config) {
        this(config, new AddonRegistry());
    }

    public App(AppConfig config, AddonRegistry registry) {
        this.config = config != null ? config : new AppConfig();
        this.uri = this.config.getUri() != null ? this.config.getUri() : AppConfig.DEFAULT_URI;
        this.registry = registry;
        this.appRunloop = new Runloop("app-" + uri);
    }

    /**
     * 启动 App：登记到全局列表、运行 addon_loader 加载 Addon，然后启动 auto_start 的预定义图。
     * 单个预定义图启动失败只记录错误，不影响 App 和其他图。
     */
    public synchronized void start() {
        if (started || closed) {
            throw new IllegalStateException("App %s already started or closed".formatted(uri));
        }
        started = true;
        appRunloop.start();
        TenGlobal.addApp(this);
        log.info("App {} 启动中，日志级别: {}", uri, config.getLog().getLevel());

        loadAddons();

        for (PredefinedGraph predefined : config.getPredefinedGraphs()) {
            if (!predefined.isAutoStart()) {
                continue;
            }
            try {
                startGraph(predefined.toGraphDefinition());
            } catch (TenException e) {
                log.error("App {}: 预定义图 {} 启动失败", uri, predefined.getName(), e);
            }
        }
        log.info("App {} 已启动，运行中的图: {}", uri, engines.keySet());
    }

    /**
     * 启动一个图。
     *
     * @return 运行中的 Engine
     */
    public Engine startGraph(GraphDefinition definition) {
        if (closed) {
            throw new IllegalStateException("App %s is closed".formatted(uri));
        }
        if (definition.getGraphId() == null || definition.getGraphId().isEmpty()) {
            definition.setGraphId(UUID.randomUUID().toString());
        }
        Engine engine = new Engine(uri, definition, registry, config.getEngine(), this);
        if (engines.putIfAbsent(engine.getGraphId(), engine) != null) {
            throw new TenException(TenErrorCode.INVALID_ARGUMENT,
                    "Graph %s is already running".formatted(engine.getGraphId()));
        }
        try {
            engine.start();
        } catch (RuntimeException e) {
            engines.remove(engine.getGraphId(), engine);
            throw e;
        }
        return engine;
    }

    /**
     * 按名称启动预定义图。
     */
    public Engine startPredefinedGraph(String name) {
        PredefinedGraph predefined = config.findPredefinedGraph(name)
                .orElseThrow(() -> new TenException(TenErrorCode.INVALID_ARGUMENT,
                        "No predefined graph named '%s'".formatted(name)));
        return startGraph(predefined.toGraphDefinition());
    }

    /**
     * 同步停止一个图。
     *
     * @return 图不存在时返回 false
     */
    public boolean stopGraph(String graphId) {
        Engine engine = engines.get(graphId);
        if (engine == null) {
            return false;
        }
        engine.stop();
        engines.remove(graphId, engine);
        return true;
    }

    public Optional<Engine> getEngine(String graphId) {
        return Optional.ofNullable(engines.get(graphId));
    }

    public Collection<Engine> getEngines() {
        return List.copyOf(engines.values());
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 停止所有图并从全局列表中移除。重复调用无效果。
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        log.info("App {} 关闭中", uri);
        for (Engine engine : List.copyOf(engines.values())) {
            try {
                engine.stop();
            } catch (RuntimeException e) {
                log.error("App {}: 停止图 {} 失败", uri, engine.getGraphId(), e);
            }
        }
        engines.clear();
        TenGlobal.removeApp(this);

        if (appRunloop.isInLoopThread()) {
            Thread closer = new Thread(appRunloop::shutdown, "ten-app-closer-" + uri);
            closer.setDaemon(true);
            closer.start();
        } else {
            appRunloop.shutdown();
        }
        closedFuture.complete(null);
        log.info("App {} 已关闭", uri);
    }

    /**
     * 等待 App 关闭（例如某个 Extension 调用了 closeApp）。
     *
     * @return 超时返回 false
     */
    public boolean awaitClosed(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            closedFuture.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    @Override
    public void onStopGraphRequested(Engine engine) {
        if (!appRunloop.postTask(() -> stopGraph(engine.getGraphId()))) {
            log.warn("App {}: 已关闭，忽略 stopGraph 请求", uri);
        }
    }

    @Override
    public void onCloseAppRequested(Engine engine) {
        log.info("App {}: 图 {} 请求关闭 App", uri, engine.getGraphId());
        if (!appRunloop.postTask(this::close)) {
            log.warn("App {}: 已关闭，忽略 closeApp 请求", uri);
        }
    }

    @Override
    public void onEngineStopped(Engine engine) {
        engines.remove(engine.getGraphId(), engine);
    }

    private void loadAddons() {
        if (!registry.isRegistered(AddonKind.ADDON_LOADER, ServiceLoaderAddonLoader.NAME)) {
            registry.register(AddonKind.ADDON_LOADER, ServiceLoaderAddonLoader.NAME, ServiceLoaderAddonLoader.addon());
        }
        for (String loaderName : registry.getNames(AddonKind.ADDON_LOADER)) {
            AddonInstance<AddonLoader> loader = null;
            try {
                loader = registry.instantiate(AddonKind.ADDON_LOADER, loaderName, loaderName, Map.of(),
                        AddonLoader.class);
                loader.getInstance().load(registry);
            } catch (TenException e) {
                log.error("App {}: addon_loader {} 加载失败", uri, loaderName, e);
            } finally {
                if (loader != null) {
                    loader.destroy();
                }
            }
        }
    }

    @Override
    public String toString() {
        return "App{uri='%s', engines=%s}".formatted(uri, engines.keySet());
    }
}
