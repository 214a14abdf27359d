package com.tenframework.runtime.extension;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.tenframework.runtime.message.AudioFrame;
import com.tenframework.runtime.message.Command;
import com.tenframework.runtime.message.CommandResult;
import com.tenframework.runtime.message.Data;
import com.tenframework.runtime.message.Location;
import com.tenframework.runtime.message.VideoFrame;

/**
 * `TenEnv` 是 `ten_env_t` 在 Java 中的对等概念，Extension 通过它发送消息、返回结果、
 * 读写属性和使用定时器。
 * <p>
 * 每个 Extension 恰好拥有一个 TenEnv，只能在所属 Extension Group 的线程上调用，
 * 其他线程调用会抛出 {@link IllegalStateException}。跨线程访问请使用 {@link #createProxy()}。
 */
public interface TenEnv {

    Location getLocation();

    String getExtensionName();

    /**
     * 发送命令。发送时对命令做快照，之后修改原对象不影响已发送的消息。
     * 没有路由时 handler 会在本次调用内同步收到 NO_ROUTE 结果。
     */
    void sendCommand(Command command, ResultHandler handler);

    /**
     * 发送命令，返回的 Future 由第一个最终结果完成。
     */
    CompletableFuture<CommandResult> sendCommand(Command command);

    /**
     * 为收到的命令返回结果。
     */
    void returnResult(CommandResult result);

    /**
     * @return 有路由时返回 true；无路由的数据会被丢弃并计数
     */
    boolean sendData(Data data);

    boolean sendAudioFrame(AudioFrame audioFrame);

    boolean sendVideoFrame(VideoFrame videoFrame);

    /**
     * 节点上配置的 property 的只读视图。
     */
    Map<String, Object> getProperties();

    /**
     * 按点分路径读取属性，例如 {@code "llm.model"}。
     */
    Optional<Object> getProperty(String path);

    String getPropertyString(String path, String defaultValue);

    int getPropertyInt(String path, int defaultValue);

    long getPropertyLong(String path, long defaultValue);

    double getPropertyDouble(String path, double defaultValue);

    boolean getPropertyBool(String path, boolean defaultValue);

    void setProperty(String path, Object value);

    /**
     * 注册一次性定时器，回调在所属线程上执行。
     */
    long setTimer(long delayMs, Runnable callback);

    boolean cancelTimer(long timerId);

    /**
     * 创建一个可以在任意线程上使用的代理。
     */
    TenEnvProxy createProxy();

    /**
     * 异步请求停止当前 Graph。
     */
    void stopGraph();

    /**
     * 异步请求关闭整个 App。
     */
    void closeApp();
}
