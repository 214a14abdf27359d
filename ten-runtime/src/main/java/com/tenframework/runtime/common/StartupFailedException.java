package com.tenframework.runtime.common;

/**
 * 某个 Extension 的启动钩子失败，整个 Engine 启动被中止。
 */
public class StartupFailedException extends TenException {

    public StartupFailedException(String message, Throwable cause) {
        super(TenErrorCode.STARTUP_FAILED, message, cause);
    }

    public StartupFailedException(String message) {
        super(TenErrorCode.STARTUP_FAILED, message);
    }
}
