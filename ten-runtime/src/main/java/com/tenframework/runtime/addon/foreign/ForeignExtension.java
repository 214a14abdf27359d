package com.tenframework.runtime.addon.foreign;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import com.tenframework.runtime.addon.AddonManifest;
import com.tenframework.runtime.addon.AddonManifest.MessageSchema;
import com.tenframework.runtime.extension.Extension;
import com.tenframework.runtime.extension.TenEnv;
import com.tenframework.runtime.message.AudioFrame;
import com.tenframework.runtime.message.Command;
import com.tenframework.runtime.message.CommandResult;
import com.tenframework.runtime.message.Data;
import com.tenframework.runtime.message.Message;
import com.tenframework.runtime.message.MessageType;
import com.tenframework.runtime.message.StatusCode;
import com.tenframework.runtime.message.VideoFrame;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 把一个原生句柄适配成 {@link Extension}。
 * 保证句柄在销毁后不会再被调用，也不会被并发调用；同一线程上的重入（例如原生侧在处理消息时
 * 发出的命令同步收到 NO_ROUTE）是允许的。
 */
@Slf4j
public class ForeignExtension implements Extension {

    @Getter
    private final String name;
    private final NativeExtensionHandle handle;
    private final AddonManifest manifest;
    private final PropertyMarshaller marshaller;
    private final ReentrantLock callLock = new ReentrantLock();
    // 收到但还没有返回最终结果的命令
    private final Map<Long, Command> receivedCommands = new HashMap<>();
    private boolean destroyed = false;
    private TenEnv env;

    public ForeignExtension(String name, NativeExtensionHandle handle, AddonManifest manifest,
            PropertyMarshaller marshaller) {
        this.name = name;
        this.handle = handle;
        this.manifest = manifest;
        this.marshaller = marshaller;
    }

    @Override
    public void onConfigure(TenEnv env) {
        this.env = env;
    }

    @Override
    public void onInit(TenEnv env) throws Exception {
        call(() -> handle.onInit(new Host()));
    }

    @Override
    public void onStart(TenEnv env) throws Exception {
        call(handle::onStart);
    }

    @Override
    public void onStop(TenEnv env) throws Exception {
        call(handle::onStop);
    }

    @Override
    public void onDeinit(TenEnv env) throws Exception {
        call(handle::onDeinit);
    }

    @Override
    public void onCommand(Command command, TenEnv env) throws Exception {
        Map<String, Object> marshaled;
        try {
            marshaled = marshaller.marshal(command, inputSchema(command));
        } catch (IllegalArgumentException e) {
            env.returnResult(CommandResult.error(command, e.getMessage()));
            return;
        }
        receivedCommands.put(command.getCommandId(), command);
        call(() -> handle.onMessage(marshaled));
    }

    @Override
    public void onData(Data data, TenEnv env) throws Exception {
        deliver(data);
    }

    @Override
    public void onAudioFrame(AudioFrame audioFrame, TenEnv env) throws Exception {
        deliver(audioFrame);
    }

    @Override
    public void onVideoFrame(VideoFrame videoFrame, TenEnv env) throws Exception {
        deliver(videoFrame);
    }

    /**
     * 调用原生销毁回调，只执行一次。
     */
    public void destroy() {
        callLock.lock();
        try {
            if (destroyed) {
                return;
            }
            destroyed = true;
            receivedCommands.clear();
            handle.destroy();
            log.debug("ForeignExtension {}: 原生句柄已销毁", name);
        } finally {
            callLock.unlock();
        }
    }

    public boolean isDestroyed() {
        callLock.lock();
        try {
            return destroyed;
        } finally {
            callLock.unlock();
        }
    }

    private void deliver(Message message) throws Exception {
        Map<String, Object> marshaled;
        try {
            marshaled = marshaller.marshal(message, inputSchema(message));
        } catch (IllegalArgumentException e) {
            log.warn("ForeignExtension {}: 丢弃无法编组的 {}: {}", name, message, e.getMessage());
            return;
        }
        call(() -> handle.onMessage(marshaled));
    }

    private MessageSchema inputSchema(Message message) {
        return manifest != null ? manifest.findInput(message.getType(), message.getName()).orElse(null) : null;
    }

    private MessageSchema outputSchema(MessageType type, String messageName) {
        return manifest != null ? manifest.findOutput(type, messageName).orElse(null) : null;
    }

    private void call(NativeCall nativeCall) throws Exception {
        if (!callLock.tryLock()) {
            throw new IllegalStateException("Concurrent call into native extension " + name);
        }
        try {
            if (destroyed) {
                throw new IllegalStateException("Native extension %s has been destroyed".formatted(name));
            }
            nativeCall.run();
        } finally {
            callLock.unlock();
        }
    }

    @FunctionalInterface
    private interface NativeCall {
        void run() throws Exception;
    }

    /**
     * 原生侧回调运行时的入口，全部转发到绑定的 TenEnv。
     */
    private class Host implements NativeHost {

        @Override
        public void returnResult(long commandId, String statusCode, boolean isFinal, Map<String, Object> properties) {
            Command command = isFinal ? receivedCommands.remove(commandId) : receivedCommands.get(commandId);
            if (command == null) {
                throw new IllegalArgumentException("No pending command %d for %s".formatted(commandId, name));
            }
            CommandResult result = CommandResult.create(StatusCode.fromValue(statusCode), command).setFinal(isFinal);
            result.setProperties(properties);
            env.returnResult(result);
        }

        @Override
        public long sendCommand(String commandName, Map<String, Object> properties) {
            MessageSchema schema = outputSchema(MessageType.CMD, commandName);
            Command command = Command.create(commandName);
            command.setProperties(schema != null
                    ? marshaller.coerceProperties(properties, schema.getProperty(), schema.getRequired())
                    : properties);
            env.sendCommand(command, (resultEnv, result) -> {
                try {
                    call(() -> handle.onCommandResult(marshaller.marshalResult(result)));
                } catch (Exception e) {
                    log.error("ForeignExtension {}: onCommandResult 失败", name, e);
                }
            });
            return command.getCommandId();
        }

        @Override
        public boolean sendData(String dataName, Map<String, Object> properties, byte[] buf) {
            MessageSchema schema = outputSchema(MessageType.DATA, dataName);
            Data data = Data.create(dataName).setBuf(buf);
            data.setProperties(schema != null
                    ? marshaller.coerceProperties(properties, schema.getProperty(), schema.getRequired())
                    : properties);
            return env.sendData(data);
        }

        @Override
        public Map<String, Object> getProperties() {
            return env.getProperties();
        }
    }
}
