package com.tenframework.runtime.addon;

import java.util.concurrent.atomic.AtomicBoolean;

import lombok.Getter;

/**
 * 一次实例化得到的句柄。{@link #destroy()} 保证销毁钩子只执行一次，重复调用无效果。
 *
 * @param <T> 实例类型
 */
public final class AddonInstance<T> {

    @Getter
    private final T instance;

    private final AddonHost<T> host;

    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    AddonInstance(T instance, AddonHost<T> host) {
        this.instance = instance;
        this.host = host;
    }

    public AddonKind getKind() {
        return host.getKind();
    }

    public String getAddonName() {
        return host.getName();
    }

    public AddonManifest getManifest() {
        return host.getManifest();
    }

    public boolean isDestroyed() {
        return destroyed.get();
    }

    /**
     * 释放该句柄。PROTOTYPE 立即销毁实例；SINGLETON 在最后一个句柄释放时销毁。
     */
    public void destroy() {
        if (destroyed.compareAndSet(false, true)) {
            host.release(this);
        }
    }
}
