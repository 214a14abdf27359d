package com.tenframework.runtime.extension;

import com.tenframework.runtime.message.CommandResult;

/**
 * 命令结果回调，在发送方 Extension 所属的线程上调用。
 * 流式结果会多次调用，最后一次的 {@link CommandResult#isFinal()} 为 true。
 */
@FunctionalInterface
public interface ResultHandler {

    void onResult(TenEnv env, CommandResult result);
}
