package com.tenframework.runtime.engine;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * 停止时对分组入站队列中剩余消息的处理策略。CommandResult 在两种策略下都会被处理。
 */
public enum DrainPolicy {
    PROCESS,
    DISCARD;

    @JsonCreator
    public static DrainPolicy fromValue(String value) {
        for (DrainPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown drain policy: " + value);
    }
}
