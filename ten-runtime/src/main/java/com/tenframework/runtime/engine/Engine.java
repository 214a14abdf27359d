package com.tenframework.runtime.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import com.tenframework.runtime.addon.AddonInstance;
import com.tenframework.runtime.addon.AddonKind;
import com.tenframework.runtime.addon.AddonRegistry;
import com.tenframework.runtime.common.StartupFailedException;
import com.tenframework.runtime.common.UnknownAddonException;
import com.tenframework.runtime.extension.ExtensionGroup;
import com.tenframework.runtime.extension.ExtensionGroupHook;
import com.tenframework.runtime.graph.ConnectionTable;
import com.tenframework.runtime.graph.GraphDefinition;
import com.tenframework.runtime.graph.GraphLoader;
import com.tenframework.runtime.graph.GraphNode;
import com.tenframework.runtime.message.Message;
import com.tenframework.runtime.runloop.Runloop;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.agrona.concurrent.ManyToOneConcurrentLinkedQueue;

/**
 * `Engine` 类代表一个 Graph 的运行实例，负责创建 Extension Group、持有消息路由器并驱动启停顺序。
 * 它对应 C 语言中的 `ten_engine_t` 结构体。
 * <p>
 * Engine 拥有自己的 Runloop：所有 Extension 发出的消息先进入 Engine 的入站队列，
 * 在 Engine 线程上完成路由和结果关联，再投递到目标分组的入站队列。
 */
@Slf4j
public class Engine implements MessageSubmitter {

    // 进程内已启动且尚未停止的 Engine，不论是否有所属 App
    private static final Set<Engine> LIVE_ENGINES = ConcurrentHashMap.newKeySet();

    @Getter
    private final String graphId;
    @Getter
    private final String appUri;
    @Getter
    private final GraphDefinition graphDefinition;
    private final AddonRegistry registry;
    @Getter
    private final EngineConfig config;
    private final EngineOwner owner;
    @Getter
    private final RouterMetrics routerMetrics = new RouterMetrics();
    private final AtomicReference<EngineState> state = new AtomicReference<>(EngineState.CREATED);
    private final ManyToOneConcurrentLinkedQueue<Message> inMsgs = new ManyToOneConcurrentLinkedQueue<>();
    // 按创建顺序
    private final List<ExtensionGroup> groups = new ArrayList<>();
    private final Object lifecycleLock = new Object();
    private volatile ConnectionTable connectionTable;
    private Runloop runloop;
    private MessageRouter router;

    public Engine(String appUri, GraphDefinition graphDefinition, AddonRegistry registry) {
        this(appUri, graphDefinition, registry, new EngineConfig(), null);
    }

    /**
     * @param owner 可以为 null，此时 stopGraph 请求由 Engine 自己异步处理
     */
    public Engine(String appUri, GraphDefinition graphDefinition, AddonRegistry registry, EngineConfig config,
            EngineOwner owner) {
        this.appUri = appUri;
        this.graphDefinition = graphDefinition;
        this.graphId = graphDefinition.getGraphId() != null ? graphDefinition.getGraphId()
                : UUID.randomUUID().toString();
        this.registry = registry;
        this.config = config != null ? config : new EngineConfig();
        this.owner = owner;
    }

    /**
     * 当前进程内存活 Engine 的快照，包括没有所属 App 的 Engine。
     */
    public static List<Engine> liveEngines() {
        return List.copyOf(LIVE_ENGINES);
    }

    public EngineState getState() {
        return state.get();
    }

    /**
     * 启动 Engine。
     * 图校验和 Addon 检查在创建任何线程之前完成，失败时不会有线程被创建。
     *
     * @throws com.tenframework.runtime.common.GraphException 图不合法
     * @throws UnknownAddonException                         节点引用了未注册的 Addon
     * @throws StartupFailedException                        有 Extension 启动失败或超时，Engine 已完整拆除
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (state.get() != EngineState.CREATED) {
                throw new IllegalStateException("Engine %s cannot start from state %s".formatted(graphId, state.get()));
            }
            GraphLoader.validate(graphDefinition);
            checkAddonsRegistered();
            connectionTable = ConnectionTable.build(graphDefinition, appUri, graphId);

            state.set(EngineState.STARTING);
            LIVE_ENGINES.add(this);
            log.info("Engine {}: 启动中，{} 个节点，{} 条路由", graphId, graphDefinition.getNodes().size(),
                    connectionTable.size());

            runloop = new Runloop("engine-" + graphId);
            runloop.registerExternalEventSource(this::drainInMsgs);
            Map<String, ExtensionGroup> groupsByName = new LinkedHashMap<>();
            router = new MessageRouter(graphId, connectionTable, Collections.unmodifiableMap(groupsByName),
                    routerMetrics, this::isStopping);
            try {
                for (String groupName : graphDefinition.getGroupNamesInOrder()) {
                    ExtensionGroup group = createGroup(groupName);
                    groups.add(group);
                    groupsByName.put(groupName, group);
                }
                runloop.start();
                List<CompletableFuture<Void>> startups = groups.stream().map(ExtensionGroup::start).toList();
                CompletableFuture.allOf(startups.toArray(new CompletableFuture[0]))
                        .get(config.getStartTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (Exception e) {
                Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                String reason = e instanceof TimeoutException
                        ? "timed out after %dms".formatted(config.getStartTimeoutMs())
                        : String.valueOf(cause.getMessage());
                log.error("Engine {}: 启动失败，开始拆除: {}", graphId, reason, cause);
                state.set(EngineState.STOPPING);
                teardown();
                state.set(EngineState.STOPPED);
                LIVE_ENGINES.remove(this);
                throw new StartupFailedException("Engine %s failed to start: %s".formatted(graphId, reason), cause);
            }
            state.set(EngineState.RUNNING);
            log.info("Engine {}: 已运行，分组: {}", graphId,
                    groups.stream().map(ExtensionGroup::getName).toList());
        }
    }

    /**
     * 停止 Engine：先向所有在途命令的发送方投递 ABORTED，再让各分组排空并停止，
     * 然后按创建的逆序销毁分组，最后关闭自身。对已停止的 Engine 调用无任何效果。
     * 不能在本 Engine 的任何分组线程或 Engine 线程上调用，请改用 {@link #requestStopGraph()}。
     */
    public void stop() {
        synchronized (lifecycleLock) {
            EngineState current = state.get();
            if (current == EngineState.STOPPED) {
                log.debug("Engine {}: 已停止，忽略重复的 stop", graphId);
                return;
            }
            if (current == EngineState.CREATED) {
                state.set(EngineState.STOPPED);
                return;
            }
            checkNotOnRuntimeThread();
            state.set(EngineState.STOPPING);
            log.info("Engine {}: 停止中", graphId);
            teardown();
            state.set(EngineState.STOPPED);
            LIVE_ENGINES.remove(this);
            log.info("Engine {}: 已停止", graphId);
        }
        if (owner != null) {
            owner.onEngineStopped(this);
        }
    }

    @Override
    public void submitMessage(Message message) {
        if (state.get() == EngineState.STOPPED) {
            log.debug("Engine {}: 已停止，丢弃 {}", graphId, message);
            return;
        }
        inMsgs.offer(message);
        Runloop loop = runloop;
        if (loop != null) {
            loop.wakeup();
        }
    }

    @Override
    public ConnectionTable getConnectionTable() {
        return connectionTable;
    }

    @Override
    public void requestStopGraph() {
        if (owner != null) {
            owner.onStopGraphRequested(this);
            return;
        }
        Thread stopper = new Thread(this::stop, "ten-engine-stopper-" + graphId);
        stopper.setDaemon(true);
        stopper.start();
    }

    @Override
    public void requestCloseApp() {
        if (owner != null) {
            owner.onCloseAppRequested(this);
            return;
        }
        log.warn("Engine {}: 没有所属 App，closeApp 按 stopGraph 处理", graphId);
        requestStopGraph();
    }

    private boolean isStopping() {
        EngineState current = state.get();
        return current == EngineState.STOPPING || current == EngineState.STOPPED;
    }

    private ExtensionGroup createGroup(String groupName) {
        List<GraphNode> members = graphDefinition.getExtensionNodes().stream()
                .filter(node -> groupName.equals(GraphDefinition.groupOf(node)))
                .toList();
        AddonInstance<ExtensionGroupHook> hook = graphDefinition.findExtensionGroup(groupName)
                .filter(node -> node.getAddon() != null && !node.getAddon().isEmpty())
                .map(node -> registry.instantiate(AddonKind.EXTENSION_GROUP, node.getAddon(), groupName,
                        node.getProperty(), ExtensionGroupHook.class))
                .orElse(null);
        return new ExtensionGroup(groupName, appUri, graphId, members, registry, this, hook);
    }

    private void checkAddonsRegistered() {
        for (GraphNode node : graphDefinition.getNodes()) {
            switch (node.getType()) {
                case EXTENSION -> {
                    if (!registry.isRegistered(AddonKind.EXTENSION, node.getAddon())) {
                        throw new UnknownAddonException(AddonKind.EXTENSION.getValue(), node.getAddon());
                    }
                }
                case EXTENSION_GROUP -> {
                    if (node.getAddon() != null && !node.getAddon().isEmpty()
                            && !registry.isRegistered(AddonKind.EXTENSION_GROUP, node.getAddon())) {
                        throw new UnknownAddonException(AddonKind.EXTENSION_GROUP.getValue(), node.getAddon());
                    }
                }
                default -> {
                }
            }
        }
    }

    private void checkNotOnRuntimeThread() {
        boolean onRuntimeThread = (runloop != null && runloop.isInLoopThread())
                || groups.stream().anyMatch(g -> g.getEventLoop().isInLoopThread());
        if (onRuntimeThread) {
            throw new IllegalStateException(
                    "Engine %s cannot be stopped synchronously from its own threads, use requestStopGraph()"
                            .formatted(graphId));
        }
    }

    private int drainInMsgs() {
        int count = 0;
        Message message;
        while ((message = inMsgs.poll()) != null) {
            try {
                router.route(message);
            } catch (Exception e) {
                log.error("Engine {}: 路由 {} 时发生异常", graphId, message, e);
            }
            count++;
        }
        return count;
    }

    private void teardown() {
        long stopTimeoutMs = config.getStopTimeoutMs();

        // 1. Engine 线程上：路由完已提交的消息，然后放弃所有在途命令
        CompletableFuture<Void> aborted = new CompletableFuture<>();
        boolean posted = runloop.isRunning() && runloop.postTask(() -> {
            try {
                drainInMsgs();
                router.abortAll();
            } finally {
                aborted.complete(null);
            }
        });
        if (posted) {
            await(aborted, stopTimeoutMs, "abort pending commands");
        }

        // 2. 通知所有分组排空并停止
        List<CompletableFuture<Void>> stops = groups.stream()
                .map(group -> group.stop(config.getDrainPolicy()))
                .toList();
        await(CompletableFuture.allOf(stops.toArray(new CompletableFuture[0])), stopTimeoutMs, "stop groups");

        // 3. 按创建的逆序销毁分组
        List<ExtensionGroup> reversed = new ArrayList<>(groups);
        Collections.reverse(reversed);
        for (ExtensionGroup group : reversed) {
            try {
                group.destroy();
            } catch (Exception e) {
                log.error("Engine {}: 销毁分组 {} 失败", graphId, group.getName(), e);
            }
        }
        groups.clear();

        // 4. 最后关闭自身
        runloop.shutdown();
        // Agrona 的并发队列不支持 clear()
        while (inMsgs.poll() != null) {
            // discard
        }
    }

    private void await(CompletableFuture<Void> future, long timeoutMs, String phase) {
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Engine {}: {} 在 {}ms 内未完成，继续拆除", graphId, phase, timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Engine {}: {} 被中断", graphId, phase);
        } catch (ExecutionException e) {
            log.error("Engine {}: {} 失败", graphId, phase, e.getCause());
        }
    }

    @Override
    public String toString() {
        return "Engine{graphId='%s', state=%s}".formatted(graphId, state.get());
    }
}
