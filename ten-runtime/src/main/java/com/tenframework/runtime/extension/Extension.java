package com.tenframework.runtime.extension;

import com.tenframework.runtime.message.AudioFrame;
import com.tenframework.runtime.message.Command;
import com.tenframework.runtime.message.CommandResult;
import com.tenframework.runtime.message.Data;
import com.tenframework.runtime.message.VideoFrame;

/**
 * `Extension` 接口定义了 Extension 的生命周期回调和消息处理方法。
 * 所有回调都在所属 Extension Group 的线程上同步调用，同组的 Extension 之间不会并发执行。
 * 它对应 C 语言中的 `ten_extension_t`。
 * <p>
 * 生命周期回调正常返回即视为完成，抛出异常视为失败：
 * 启动阶段任何一个 Extension 失败都会使整个 Engine 启动失败。
 */
public interface Extension {

    /**
     * Extension 配置回调方法。
     *
     * @param env Extension 的运行时环境。
     */
    default void onConfigure(TenEnv env) throws Exception {
    }

    /**
     * Extension 初始化回调方法。
     *
     * @param env Extension 的运行时环境。
     */
    default void onInit(TenEnv env) throws Exception {
    }

    /**
     * Extension 启动回调方法。
     *
     * @param env Extension 的运行时环境。
     */
    default void onStart(TenEnv env) throws Exception {
    }

    default void onStop(TenEnv env) throws Exception {
    }

    default void onDeinit(TenEnv env) throws Exception {
    }

    /**
     * 处理命令消息。必须（立即或稍后）通过 {@link TenEnv#returnResult(CommandResult)} 返回一个最终结果。
     * 默认实现返回 ERROR。
     *
     * @param command 命令消息。
     * @param env     Extension 的运行时环境。
     */
    default void onCommand(Command command, TenEnv env) throws Exception {
        env.returnResult(CommandResult.error(command, "Unsupported command: " + command.getName()));
    }

    default void onData(Data data, TenEnv env) throws Exception {
    }

    default void onAudioFrame(AudioFrame audioFrame, TenEnv env) throws Exception {
    }

    default void onVideoFrame(VideoFrame videoFrame, TenEnv env) throws Exception {
    }
}
