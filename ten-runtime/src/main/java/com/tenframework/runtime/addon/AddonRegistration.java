package com.tenframework.runtime.addon;

/**
 * Addon 的注册入口，模块加载时调用一次。
 * 通过 {@link java.util.ServiceLoader} 发现，实现类需要列在
 * {@code META-INF/services/com.tenframework.runtime.addon.AddonRegistration} 中。
 */
public interface AddonRegistration {

    void register(AddonRegistry registry);
}
