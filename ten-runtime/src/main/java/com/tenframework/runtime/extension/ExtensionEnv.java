package com.tenframework.runtime.extension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import com.tenframework.runtime.engine.MessageSubmitter;
import com.tenframework.runtime.message.AudioFrame;
import com.tenframework.runtime.message.Command;
import com.tenframework.runtime.message.CommandResult;
import com.tenframework.runtime.message.Data;
import com.tenframework.runtime.message.Location;
import com.tenframework.runtime.message.Message;
import com.tenframework.runtime.message.MessageType;
import com.tenframework.runtime.message.MessageUtils;
import com.tenframework.runtime.message.VideoFrame;
import lombok.extern.slf4j.Slf4j;
import org.agrona.collections.Long2ObjectHashMap;
import org.agrona.collections.LongHashSet;

/**
 * {@link TenEnv} 的实现，每个 Extension 一个，由所属的 {@link ExtensionGroup} 创建和销毁。
 * 除 {@link #createProxy()} 外所有方法都只能在分组线程上调用，内部状态因此无需加锁。
 */
@Slf4j
public class ExtensionEnv implements TenEnv {

    private static final ResultHandler IGNORE_RESULT = (env, result) -> {
    };

    private record PendingCommand(long commandId, String name, ResultHandler handler) {
    }

    private final ExtensionGroup group;
    private final Location location;
    private final MessageSubmitter submitter;
    private final Map<String, Object> properties;

    // 本 Extension 发出、尚未结清的命令：commandId -> 回调
    private final Long2ObjectHashMap<PendingCommand> pendingHandlers = new Long2ObjectHashMap<>();
    // 本 Extension 收到、尚未返回最终结果的命令
    private final LongHashSet awaitingReturn = new LongHashSet();
    private final LongHashSet activeTimers = new LongHashSet();
    private final AtomicInteger liveProxies = new AtomicInteger();
    private volatile boolean closed = false;

    ExtensionEnv(ExtensionGroup group, Location location, Map<String, Object> properties,
            MessageSubmitter submitter) {
        this.group = group;
        this.location = location;
        this.submitter = submitter;
        this.properties = MessageUtils.deepCopyMap(properties);
    }

    @Override
    public Location getLocation() {
        return location.copy();
    }

    @Override
    public String getExtensionName() {
        return location.getExtensionName();
    }

    @Override
    public void sendCommand(Command command, ResultHandler handler) {
        checkThread();
        Objects.requireNonNull(command, "command");
        // 转发收到的命令时换用新的关联 ID，上一跳的路径仍由原 commandId 占用
        Command snapshot = isForeign(command) ? command.copyAsNewCommand() : command.copy(true);
        snapshot.setSrcLoc(location.copy());

        List<Location> destinations = submitter.getConnectionTable().resolve(location, MessageType.CMD,
                snapshot.getName());
        if (destinations.isEmpty()) {
            submitter.getRouterMetrics().getCommandsNoRoute().inc();
            log.warn("Extension {}: 命令 {} 没有路由", location, snapshot.getName());
            invokeHandler(handler != null ? handler : IGNORE_RESULT, CommandResult.noRoute(snapshot));
            return;
        }
        if (pendingHandlers.containsKey(snapshot.getCommandId())) {
            throw new IllegalStateException("Command %d is already in flight".formatted(snapshot.getCommandId()));
        }
        pendingHandlers.put(snapshot.getCommandId(), new PendingCommand(snapshot.getCommandId(), snapshot.getName(),
                handler != null ? handler : IGNORE_RESULT));
        submitter.submitMessage(snapshot);
    }

    private boolean isForeign(Command command) {
        if (awaitingReturn.contains(command.getCommandId())) {
            return true;
        }
        Location source = command.getSrcLoc();
        return source != null && !source.equals(location);
    }

    @Override
    public CompletableFuture<CommandResult> sendCommand(Command command) {
        CompletableFuture<CommandResult> future = new CompletableFuture<>();
        sendCommand(command, (env, result) -> {
            if (result.isFinal()) {
                future.complete(result);
            }
        });
        return future;
    }

    @Override
    public void returnResult(CommandResult result) {
        checkThread();
        Objects.requireNonNull(result, "result");
        CommandResult snapshot = result.copy(true);
        snapshot.setSrcLoc(location.copy());
        if (snapshot.isFinal()) {
            awaitingReturn.remove(snapshot.getInResponseTo());
        }
        submitter.submitMessage(snapshot);
    }

    @Override
    public boolean sendData(Data data) {
        return sendNonCommand(data);
    }

    @Override
    public boolean sendAudioFrame(AudioFrame audioFrame) {
        return sendNonCommand(audioFrame);
    }

    @Override
    public boolean sendVideoFrame(VideoFrame videoFrame) {
        return sendNonCommand(videoFrame);
    }

    private boolean sendNonCommand(Message message) {
        checkThread();
        Objects.requireNonNull(message, "message");
        Message snapshot = message.copy(true);
        snapshot.setSrcLoc(location.copy());
        if (submitter.getConnectionTable().resolve(location, snapshot.getType(), snapshot.getName()).isEmpty()) {
            submitter.getRouterMetrics().getMessagesDropped().inc();
            log.debug("Extension {}: {} 没有路由，已丢弃", location, snapshot);
            return false;
        }
        submitter.submitMessage(snapshot);
        return true;
    }

    @Override
    public Map<String, Object> getProperties() {
        checkThread();
        return Collections.unmodifiableMap(properties);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<Object> getProperty(String path) {
        checkThread();
        Object current = properties;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = ((Map<String, Object>) map).get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    @Override
    public String getPropertyString(String path, String defaultValue) {
        return getProperty(path).map(String::valueOf).orElse(defaultValue);
    }

    @Override
    public int getPropertyInt(String path, int defaultValue) {
        return getProperty(path).map(v -> toNumber(v, path)).map(Number::intValue).orElse(defaultValue);
    }

    @Override
    public long getPropertyLong(String path, long defaultValue) {
        return getProperty(path).map(v -> toNumber(v, path)).map(Number::longValue).orElse(defaultValue);
    }

    @Override
    public double getPropertyDouble(String path, double defaultValue) {
        return getProperty(path).map(v -> toNumber(v, path)).map(Number::doubleValue).orElse(defaultValue);
    }

    @Override
    public boolean getPropertyBool(String path, boolean defaultValue) {
        return getProperty(path).map(v -> v instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(v)))
                .orElse(defaultValue);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void setProperty(String path, Object value) {
        checkThread();
        String[] segments = path.split("\\.");
        Map<String, Object> current = properties;
        for (int i = 0; i < segments.length - 1; i++) {
            Object next = current.get(segments[i]);
            if (!(next instanceof Map<?, ?>)) {
                next = new LinkedHashMap<String, Object>();
                current.put(segments[i], next);
            }
            current = (Map<String, Object>) next;
        }
        String last = segments[segments.length - 1];
        if (value == null) {
            current.remove(last);
        } else {
            current.put(last, value);
        }
    }

    private static Number toNumber(Object value, String path) {
        if (value instanceof Number number) {
            return number;
        }
        try {
            return Double.valueOf(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property '%s' is not a number: %s".formatted(path, value), e);
        }
    }

    @Override
    public long setTimer(long delayMs, Runnable callback) {
        checkThread();
        Objects.requireNonNull(callback, "callback");
        long[] holder = new long[1];
        holder[0] = group.getEventLoop().scheduleTimer(delayMs, () -> {
            activeTimers.remove(holder[0]);
            if (closed) {
                return;
            }
            try {
                callback.run();
            } catch (Exception e) {
                log.error("Extension {}: 定时器回调发生异常", location, e);
            }
        });
        activeTimers.add(holder[0]);
        return holder[0];
    }

    @Override
    public boolean cancelTimer(long timerId) {
        checkThread();
        activeTimers.remove(timerId);
        return group.getEventLoop().cancelTimer(timerId);
    }

    @Override
    public TenEnvProxy createProxy() {
        if (closed) {
            throw new IllegalStateException("TenEnv of %s is closed".formatted(location));
        }
        liveProxies.incrementAndGet();
        return new TenEnvProxy(this, group.getEventLoop());
    }

    @Override
    public void stopGraph() {
        checkThread();
        log.info("Extension {} 请求停止 Graph", location);
        submitter.requestStopGraph();
    }

    @Override
    public void closeApp() {
        checkThread();
        log.info("Extension {} 请求关闭 App", location);
        submitter.requestCloseApp();
    }

    boolean isClosed() {
        return closed;
    }

    /**
     * 收到一条发给本 Extension 的命令
     */
    void beginCommand(long commandId) {
        awaitingReturn.add(commandId);
    }

    boolean isAwaitingReturn(long commandId) {
        return awaitingReturn.contains(commandId);
    }

    int getPendingCommandCount() {
        return pendingHandlers.size();
    }

    /**
     * 路由器送回的结果。completesCommand 为 true 时该命令已结清，回调随之移除。
     */
    void dispatchResult(CommandResult result, boolean completesCommand) {
        long commandId = result.getInResponseTo();
        PendingCommand pending = completesCommand ? pendingHandlers.remove(commandId) : pendingHandlers.get(commandId);
        if (pending == null) {
            log.warn("Extension {}: 收到未知命令 {} 的结果，丢弃", location, commandId);
            return;
        }
        invokeHandler(pending.handler(), result);
    }

    /**
     * 最后一个代理释放，在分组线程上调用
     */
    void onProxyReleased() {
        int remaining = liveProxies.decrementAndGet();
        log.debug("Extension {}: 代理已释放，剩余 {}", location, remaining);
    }

    void close() {
        closed = true;
        activeTimers.forEach(id -> group.getEventLoop().cancelTimer(id));
        activeTimers.clear();
        if (!pendingHandlers.isEmpty()) {
            log.debug("Extension {}: 关闭时仍有 {} 个命令未结清，逐个回调 ABORTED", location, pendingHandlers.size());
            List<PendingCommand> remaining = new ArrayList<>(pendingHandlers.values());
            pendingHandlers.clear();
            for (PendingCommand pending : remaining) {
                invokeHandler(pending.handler(), CommandResult.aborted(pending.commandId(), pending.name()));
            }
        }
        if (liveProxies.get() > 0) {
            log.warn("Extension {}: 关闭时仍有 {} 个未释放的代理", location, liveProxies.get());
        }
    }

    private void invokeHandler(ResultHandler handler, CommandResult result) {
        try {
            handler.onResult(this, result);
        } catch (Exception e) {
            log.error("Extension {}: 结果回调发生异常", location, e);
        }
    }

    private void checkThread() {
        if (closed) {
            throw new IllegalStateException("TenEnv of %s is closed".formatted(location));
        }
        if (!group.getEventLoop().isInLoopThread()) {
            throw new IllegalStateException("TenEnv of %s must be used on its own extension group thread, not %s"
                    .formatted(location, Thread.currentThread().getName()));
        }
    }
}
