package com.tenframework.runtime.addon;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Addon 的种类，对应 manifest 中的 type 字段。
 */
@Getter
public enum AddonKind {

    EXTENSION("extension"),

    EXTENSION_GROUP("extension_group"),

    PROTOCOL("protocol"),

    ADDON_LOADER("addon_loader");

    @JsonValue
    private final String value;

    AddonKind(String value) {
        this.value = value;
    }

    @JsonCreator
    public static AddonKind fromValue(String value) {
        for (AddonKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown addon kind: " + value);
    }
}
