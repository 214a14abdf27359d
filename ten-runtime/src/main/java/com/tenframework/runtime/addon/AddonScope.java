package com.tenframework.runtime.addon;

/**
 * 实例化范围。SINGLETON 在所有使用者之间共享同一个实例。
 */
public enum AddonScope {
    PROTOTYPE,
    SINGLETON
}
