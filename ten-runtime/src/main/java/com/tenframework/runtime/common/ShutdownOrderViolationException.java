package com.tenframework.runtime.common;

/**
 * 在仍有 App 存活时调用了进程级 deinit。
 */
public class ShutdownOrderViolationException extends TenException {

    public ShutdownOrderViolationException(String message) {
        super(TenErrorCode.SHUTDOWN_ORDER_VIOLATION, message);
    }
}
