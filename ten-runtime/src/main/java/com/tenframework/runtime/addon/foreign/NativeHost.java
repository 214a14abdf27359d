package com.tenframework.runtime.addon.foreign;

import java.util.Map;

/**
 * 运行时交给原生句柄的回调接口，只能在句柄被调用的线程上使用。
 */
public interface NativeHost {

    void returnResult(long commandId, String statusCode, boolean isFinal, Map<String, Object> properties);

    /**
     * @return 命令的关联 ID，结果经 {@link NativeExtensionHandle#onCommandResult} 送回时的 in_response_to
     */
    long sendCommand(String name, Map<String, Object> properties);

    boolean sendData(String name, Map<String, Object> properties, byte[] buf);

    Map<String, Object> getProperties();
}
