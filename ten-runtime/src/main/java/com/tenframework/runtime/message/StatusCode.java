package com.tenframework.runtime.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * CommandResult 的状态码。
 */
public enum StatusCode {
    OK("ok"),
    ERROR("error"),
    /**
     * 命令在 Graph 中没有任何目的地
     */
    NO_ROUTE("no_route"),
    /**
     * 命令仍在途中时其所属 Engine 被拆除
     */
    ABORTED("aborted");

    private final String value;

    StatusCode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StatusCode fromValue(String value) {
        for (StatusCode code : values()) {
            if (code.value.equalsIgnoreCase(value)) {
                return code;
            }
        }
        throw new IllegalArgumentException("未知的状态码: " + value);
    }
}
