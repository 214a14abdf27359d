package com.tenframework.runtime.engine;

/**
 * Engine 状态机：CREATED -> STARTING -> RUNNING -> STOPPING -> STOPPED。
 * 启动失败时从 STARTING 直接进入 STOPPING。
 */
public enum EngineState {
    CREATED,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED
}
