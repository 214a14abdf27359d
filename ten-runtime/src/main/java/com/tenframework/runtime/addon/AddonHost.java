package com.tenframework.runtime.addon;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import com.tenframework.runtime.common.TenErrorCode;
import com.tenframework.runtime.common.TenException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 单个注册项的宿主：持有工厂、manifest 和环境句柄，并负责 SINGLETON 的共享与引用计数。
 * 每个宿主一把锁，同一 SINGLETON 的工厂不会被并发调用，不同 Addon 之间互不阻塞。
 */
@Slf4j
final class AddonHost<T> {

    @Getter
    private final AddonKind kind;

    @Getter
    private final String name;

    @Getter
    private final AddonManifest manifest;

    private final Addon<T> addon;

    private final AddonEnv env;

    private final ReentrantLock lock = new ReentrantLock();

    private T sharedInstance;

    private int sharedRefCount;

    AddonHost(AddonKind kind, String name, Addon<T> addon, AddonManifest manifest) {
        this.kind = kind;
        this.name = name;
        this.addon = addon;
        this.manifest = manifest;
        this.env = new AddonEnv(kind, name, manifest);
    }

    AddonInstance<T> instantiate(String instanceName, Map<String, Object> config) {
        if (addon.scope() == AddonScope.SINGLETON) {
            lock.lock();
            try {
                if (sharedInstance == null) {
                    sharedInstance = create(instanceName, config);
                    log.info("Addon {} 单例已创建", env);
                }
                sharedRefCount++;
                return new AddonInstance<>(sharedInstance, this);
            } finally {
                lock.unlock();
            }
        }
        return new AddonInstance<>(create(instanceName, config), this);
    }

    void release(AddonInstance<T> handle) {
        if (addon.scope() == AddonScope.SINGLETON) {
            T toDestroy = null;
            lock.lock();
            try {
                if (sharedRefCount > 0 && --sharedRefCount == 0) {
                    toDestroy = sharedInstance;
                    sharedInstance = null;
                }
                if (toDestroy != null) {
                    destroy(toDestroy);
                    log.info("Addon {} 单例已销毁", env);
                }
            } finally {
                lock.unlock();
            }
            return;
        }
        destroy(handle.getInstance());
    }

    private T create(String instanceName, Map<String, Object> config) {
        T instance;
        try {
            instance = addon.onCreateInstance(env, instanceName, config != null ? config : Map.of());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new TenException(TenErrorCode.GENERIC,
                    "Addon %s failed to create instance '%s'".formatted(env, instanceName), e);
        }
        if (instance == null) {
            throw new TenException(TenErrorCode.GENERIC,
                    "Addon %s returned no instance for '%s'".formatted(env, instanceName));
        }
        return instance;
    }

    private void destroy(T instance) {
        try {
            addon.onDestroyInstance(env, instance);
        } catch (Exception e) {
            log.error("Addon {} 销毁实例失败", env, e);
        }
    }
}
