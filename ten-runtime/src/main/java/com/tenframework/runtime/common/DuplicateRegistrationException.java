package com.tenframework.runtime.common;

public class DuplicateRegistrationException extends TenException {

    public DuplicateRegistrationException(String kind, String name) {
        super(TenErrorCode.DUPLICATE_REGISTRATION, "Addon 已注册: kind=%s, name=%s".formatted(kind, name));
    }
}
