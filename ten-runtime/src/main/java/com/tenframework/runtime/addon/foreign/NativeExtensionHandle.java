package com.tenframework.runtime.addon.foreign;

import java.util.Map;

/**
 * 原生 Extension 实例的句柄。所有方法都由所属分组线程调用，永远不会并发；
 * {@link #destroy()} 之后不会再有任何调用。
 * <p>
 * 消息以编组后的 Map 传入，键包括 type、id、name、properties，以及按类型附加的
 * command_id、buf、帧参数等。
 */
public interface NativeExtensionHandle {

    /**
     * 句柄已绑定到新建的环境，host 是原生侧回调运行时的唯一入口。
     */
    void onInit(NativeHost host) throws Exception;

    default void onStart() throws Exception {
    }

    default void onStop() throws Exception {
    }

    default void onDeinit() throws Exception {
    }

    void onMessage(Map<String, Object> message) throws Exception;

    /**
     * 原生侧通过 {@link NativeHost#sendCommand} 发出的命令的结果。
     */
    default void onCommandResult(Map<String, Object> result) throws Exception {
    }

    /**
     * 销毁回调，运行时保证只调用一次。
     */
    void destroy();
}
