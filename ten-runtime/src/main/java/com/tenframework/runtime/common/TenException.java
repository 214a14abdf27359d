package com.tenframework.runtime.common;

import lombok.Getter;

/**
 * 运行时所有结构性错误的根异常。
 * 路由层面的情况（NoRoute、StaleResult、Aborted）不会抛出异常，而是以 CommandResult 的状态码返回。
 */
@Getter
public class TenException extends RuntimeException {

    private final TenErrorCode errorCode;

    public TenException(TenErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TenException(TenErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
