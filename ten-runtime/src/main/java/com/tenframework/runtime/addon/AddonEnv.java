package com.tenframework.runtime.addon;

import lombok.Getter;

/**
 * Addon 的环境句柄，每个注册项恰好一个，生命周期与注册项绑定。
 */
@Getter
public class AddonEnv {

    private final AddonKind kind;

    private final String name;

    private final AddonManifest manifest;

    AddonEnv(AddonKind kind, String name, AddonManifest manifest) {
        this.kind = kind;
        this.name = name;
        this.manifest = manifest;
    }

    @Override
    public String toString() {
        return kind.getValue() + ":" + name;
    }
}
