package com.tenframework.runtime.common;

/**
 * 运行时错误码，对应 C 语言中的 TEN_ERROR_CODE。
 */
public enum TenErrorCode {
    GENERIC,
    INVALID_ARGUMENT,
    INVALID_GRAPH,
    DUPLICATE_REGISTRATION,
    UNKNOWN_ADDON,
    STARTUP_FAILED,
    SHUTDOWN_ORDER_VIOLATION,
    TIMEOUT
}
