package com.tenframework.runtime.common;

public class UnknownAddonException extends TenException {

    public UnknownAddonException(String kind, String name) {
        super(TenErrorCode.UNKNOWN_ADDON, "未注册的 Addon: kind=%s, name=%s".formatted(kind, name));
    }
}
