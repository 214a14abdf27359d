package com.tenframework.runtime.extension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.codahale.metrics.Timer;
import com.tenframework.runtime.addon.AddonInstance;
import com.tenframework.runtime.addon.AddonKind;
import com.tenframework.runtime.addon.AddonManifest;
import com.tenframework.runtime.addon.AddonRegistry;
import com.tenframework.runtime.engine.DrainPolicy;
import com.tenframework.runtime.engine.MessageSubmitter;
import com.tenframework.runtime.graph.GraphNode;
import com.tenframework.runtime.message.AudioFrame;
import com.tenframework.runtime.message.Command;
import com.tenframework.runtime.message.CommandResult;
import com.tenframework.runtime.message.Data;
import com.tenframework.runtime.message.Location;
import com.tenframework.runtime.message.Message;
import com.tenframework.runtime.message.VideoFrame;
import com.tenframework.runtime.runloop.EventLoop;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.agrona.concurrent.ManyToOneConcurrentLinkedQueue;

/**
 * Extension Group：一组共享同一个事件循环的 Extension，是线程亲和的最小单位。
 * 对应 C 语言中的 ten_extension_group_t / ten_extension_thread_t。
 * <p>
 * 入站队列是唯一被其他线程触碰的状态；Extension 实例、环境句柄都只在事件循环线程上访问。
 */
@Slf4j
public class ExtensionGroup {

    private static final int DRAIN_BATCH = 64;
    // 停止时按 PROCESS 策略最多处理的消息数，防止自环的 Extension 让停止永不结束
    private static final int SHUTDOWN_DRAIN_LIMIT = 10_000;
    private static final ExtensionGroupHook DEFAULT_HOOK = new ExtensionGroupHook() {
    };

    @Getter
    private final String name;
    private final String appUri;
    private final String graphId;
    private final List<GraphNode> extensionNodes;
    private final AddonRegistry registry;
    private final MessageSubmitter submitter;
    private final AddonInstance<ExtensionGroupHook> hookInstance;
    private final ExtensionGroupHook hook;
    @Getter
    private final EventLoop eventLoop;
    private final ManyToOneConcurrentLinkedQueue<Delivery> inbound = new ManyToOneConcurrentLinkedQueue<>();
    private final Map<String, ExtensionSlot> slots = new LinkedHashMap<>();
    private final Timer handlerTimer;
    private volatile boolean started = false;
    private volatile boolean closed = false;
    private boolean hookInited = false;

    /**
     * @param hookInstance extension_group Addon 的实例，可以为 null
     */
    public ExtensionGroup(String name, String appUri, String graphId, List<GraphNode> extensionNodes,
            AddonRegistry registry, MessageSubmitter submitter, AddonInstance<ExtensionGroupHook> hookInstance) {
        this.name = name;
        this.appUri = appUri;
        this.graphId = graphId;
        this.extensionNodes = List.copyOf(extensionNodes);
        this.registry = registry;
        this.submitter = submitter;
        this.hookInstance = hookInstance;
        this.hook = hookInstance != null ? hookInstance.getInstance() : DEFAULT_HOOK;
        this.eventLoop = hook.createEventLoop(graphId + "-" + name);
        this.eventLoop.registerExternalEventSource(this::drainInbound);
        this.handlerTimer = submitter.getRouterMetrics().handlerTimer(name);
    }

    /**
     * 启动事件循环，并在其线程上实例化本组的 Extension，依次执行 onConfigure、onInit、onStart。
     * 启动任务先于任何入站消息执行。
     */
    public CompletableFuture<Void> start() {
        CompletableFuture<Void> startup = new CompletableFuture<>();
        eventLoop.postTask(() -> runStartup(startup));
        started = true;
        eventLoop.start();
        return startup;
    }

    /**
     * 由路由器调用，线程安全。
     *
     * @return 分组已停止时返回 false，消息被丢弃
     */
    public boolean enqueue(Delivery delivery) {
        if (closed) {
            log.debug("ExtensionGroup {} 已停止，丢弃 {}", name, delivery);
            return false;
        }
        inbound.offer(delivery);
        eventLoop.wakeup();
        return true;
    }

    /**
     * 停止本组：先按策略排空入站队列（结果总会被处理），再按创建的逆序执行 onStop、onDeinit 并销毁实例。
     */
    public CompletableFuture<Void> stop(DrainPolicy drainPolicy) {
        CompletableFuture<Void> stopped = new CompletableFuture<>();
        if (!started || !eventLoop.postTask(() -> runShutdown(drainPolicy, stopped))) {
            stopped.complete(null);
        }
        return stopped;
    }

    /**
     * 关闭事件循环并销毁分组 Addon 实例。必须在 {@link #stop} 完成（或超时）之后调用。
     */
    public void destroy() {
        closed = true;
        eventLoop.shutdown();
        while (inbound.poll() != null) {
            // 销毁后残留的入站消息直接丢弃
        }
        if (hookInstance != null) {
            hookInstance.destroy();
        }
        log.info("ExtensionGroup {} 已销毁", name);
    }

    public List<String> getExtensionNames() {
        return extensionNodes.stream().map(GraphNode::getName).toList();
    }

    private void runStartup(CompletableFuture<Void> startup) {
        try {
            hook.onInit(name);
            hookInited = true;

            for (GraphNode node : extensionNodes) {
                AddonInstance<Extension> instance = registry.instantiate(AddonKind.EXTENSION, node.getAddon(),
                        node.getName(), node.getProperty(), Extension.class);
                Location location = new Location(appUri, graphId, name, node.getName());
                ExtensionEnv env = new ExtensionEnv(this, location, node.getProperty(), submitter);
                slots.put(node.getName(), new ExtensionSlot(node.getName(), instance, env));
            }
            for (ExtensionSlot slot : slots.values()) {
                slot.extension().onConfigure(slot.env);
                slot.stage = Stage.CONFIGURED;
            }
            for (ExtensionSlot slot : slots.values()) {
                slot.extension().onInit(slot.env);
                slot.stage = Stage.INITIALIZED;
            }
            for (ExtensionSlot slot : slots.values()) {
                slot.extension().onStart(slot.env);
                slot.stage = Stage.STARTED;
            }
            log.info("ExtensionGroup {} 已启动，Extension: {}", name, slots.keySet());
            startup.complete(null);
        } catch (Throwable e) {
            log.error("ExtensionGroup {} 启动失败", name, e);
            startup.completeExceptionally(e);
        }
    }

    private void runShutdown(DrainPolicy drainPolicy, CompletableFuture<Void> stopped) {
        try {
            drainForShutdown(drainPolicy);
            closed = true;

            List<ExtensionSlot> reversed = new ArrayList<>(slots.values());
            Collections.reverse(reversed);
            for (ExtensionSlot slot : reversed) {
                if (slot.stage == Stage.STARTED) {
                    runHook(slot, "onStop", () -> slot.extension().onStop(slot.env));
                }
            }
            for (ExtensionSlot slot : reversed) {
                if (slot.stage == Stage.STARTED || slot.stage == Stage.INITIALIZED) {
                    runHook(slot, "onDeinit", () -> slot.extension().onDeinit(slot.env));
                }
            }
            for (ExtensionSlot slot : reversed) {
                slot.env.close();
                slot.instance.destroy();
                slot.stage = Stage.DESTROYED;
            }
            slots.clear();

            if (hookInited) {
                try {
                    hook.onDeinit(name);
                } catch (Exception e) {
                    log.error("ExtensionGroup {}: 分组 onDeinit 失败", name, e);
                }
            }
            log.info("ExtensionGroup {} 已停止", name);
        } finally {
            stopped.complete(null);
        }
    }

    private void drainForShutdown(DrainPolicy drainPolicy) {
        int processed = 0;
        int discarded = 0;
        Delivery delivery;
        while ((delivery = inbound.poll()) != null) {
            boolean isResult = delivery.getMessage() instanceof CommandResult;
            if (isResult || (drainPolicy == DrainPolicy.PROCESS && processed < SHUTDOWN_DRAIN_LIMIT)) {
                dispatch(delivery);
                processed++;
            } else {
                discarded++;
            }
        }
        if (discarded > 0) {
            log.warn("ExtensionGroup {} 停止时丢弃了 {} 条入站消息", name, discarded);
        }
    }

    private int drainInbound() {
        int count = 0;
        Delivery delivery;
        while (count < DRAIN_BATCH && (delivery = inbound.poll()) != null) {
            dispatch(delivery);
            count++;
        }
        return count;
    }

    private void dispatch(Delivery delivery) {
        Message message = delivery.getMessage();
        ExtensionSlot slot = slots.get(delivery.getTargetExtension());
        if (slot == null || slot.stage != Stage.STARTED) {
            log.warn("ExtensionGroup {}: 目标 Extension {} 不存在或未运行，丢弃 {}", name,
                    delivery.getTargetExtension(), message);
            if (message instanceof Command command) {
                CommandResult error = CommandResult.error(command,
                        "Extension %s is not running".formatted(delivery.getTargetExtension()));
                error.setSrcLoc(new Location(appUri, graphId, name, delivery.getTargetExtension()));
                submitter.submitMessage(error);
            }
            return;
        }

        if (message instanceof CommandResult result) {
            slot.env.dispatchResult(result, delivery.isCompletesCommand());
            return;
        }

        checkDeclaredInput(slot, message);
        Timer.Context context = handlerTimer.time();
        try {
            switch (message.getType()) {
                case CMD -> {
                    Command command = (Command) message;
                    slot.env.beginCommand(command.getCommandId());
                    slot.extension().onCommand(command, slot.env);
                }
                case DATA -> slot.extension().onData((Data) message, slot.env);
                case AUDIO_FRAME -> slot.extension().onAudioFrame((AudioFrame) message, slot.env);
                case VIDEO_FRAME -> slot.extension().onVideoFrame((VideoFrame) message, slot.env);
                default -> log.warn("ExtensionGroup {}: 无法分发的消息类型 {}", name, message.getType());
            }
        } catch (Throwable e) {
            log.error("Extension {} 处理 {} 时发生异常", slot.name, message, e);
            if (message instanceof Command command && slot.env.isAwaitingReturn(command.getCommandId())) {
                slot.env.returnResult(CommandResult.error(command, "Handler failed: " + e.getMessage()));
            }
        } finally {
            context.stop();
        }
    }

    private void checkDeclaredInput(ExtensionSlot slot, Message message) {
        AddonManifest manifest = slot.instance.getManifest();
        if (manifest != null && manifest.declaresInputs(message.getType())
                && manifest.findInput(message.getType(), message.getName()).isEmpty()) {
            log.warn("Extension {} 的 manifest 未声明输入 {} '{}'", slot.name, message.getType().getValue(),
                    message.getName());
        }
    }

    private void runHook(ExtensionSlot slot, String hookName, LifecycleCall call) {
        try {
            call.run();
        } catch (Exception e) {
            log.error("Extension {} {} 失败", slot.name, hookName, e);
        }
    }

    @FunctionalInterface
    private interface LifecycleCall {
        void run() throws Exception;
    }

    private enum Stage {
        CREATED,
        CONFIGURED,
        INITIALIZED,
        STARTED,
        DESTROYED
    }

    private static final class ExtensionSlot {
        private final String name;
        private final AddonInstance<Extension> instance;
        private final ExtensionEnv env;
        private Stage stage = Stage.CREATED;

        private ExtensionSlot(String name, AddonInstance<Extension> instance, ExtensionEnv env) {
            this.name = name;
            this.instance = instance;
            this.env = env;
        }

        private Extension extension() {
            return instance.getInstance();
        }
    }
}
