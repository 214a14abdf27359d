package com.tenframework.runtime.engine;

/**
 * Engine 的所有者（通常是 App），接收来自图内部的拆除请求。
 * 回调可能在任意线程上发生，实现不能在回调里同步停止 Engine。
 */
public interface EngineOwner {

    void onStopGraphRequested(Engine engine);

    void onCloseAppRequested(Engine engine);

    /**
     * Engine 已进入 STOPPED
     */
    void onEngineStopped(Engine engine);
}
