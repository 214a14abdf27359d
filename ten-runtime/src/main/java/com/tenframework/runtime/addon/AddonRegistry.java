package com.tenframework.runtime.addon;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import com.tenframework.runtime.common.DuplicateRegistrationException;
import com.tenframework.runtime.common.TenErrorCode;
import com.tenframework.runtime.common.TenException;
import com.tenframework.runtime.common.UnknownAddonException;
import lombok.extern.slf4j.Slf4j;

/**
 * (kind, name) 到工厂的注册表。由 App 持有，线程安全。
 * <p>
 * 注册冲突时保留先注册的一方；实例化不持有注册表级别的锁，只有同一 SINGLETON
 * 的实例化会在其宿主上串行。
 */
@Slf4j
public class AddonRegistry {

    private final Map<AddonKey, AddonHost<?>> hosts = new ConcurrentHashMap<>();

    public <T> void register(AddonKind kind, String name, Addon<T> addon) {
        register(kind, name, addon, null);
    }

    /**
     * 注册一个 Addon。
     *
     * @throws DuplicateRegistrationException (kind, name) 已存在
     * @throws TenException                   manifest 与注册键不一致
     */
    public <T> void register(AddonKind kind, String name, Addon<T> addon, AddonManifest manifest) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(addon, "addon");
        if (name == null || name.isEmpty()) {
            throw new TenException(TenErrorCode.INVALID_ARGUMENT, "Addon name must not be empty");
        }
        if (manifest != null) {
            manifest.checkMatches(kind, name);
        }
        AddonHost<?> previous = hosts.putIfAbsent(new AddonKey(kind, name), new AddonHost<>(kind, name, addon, manifest));
        if (previous != null) {
            throw new DuplicateRegistrationException(kind.getValue(), name);
        }
        log.info("Addon 已注册: {}:{}", kind.getValue(), name);
    }

    public boolean unregister(AddonKind kind, String name) {
        boolean removed = hosts.remove(new AddonKey(kind, name)) != null;
        if (removed) {
            log.info("Addon 已注销: {}:{}", kind.getValue(), name);
        }
        return removed;
    }

    public boolean isRegistered(AddonKind kind, String name) {
        return hosts.containsKey(new AddonKey(kind, name));
    }

    public Optional<AddonManifest> getManifest(AddonKind kind, String name) {
        return Optional.ofNullable(hosts.get(new AddonKey(kind, name))).map(AddonHost::getManifest);
    }

    public Set<String> getNames(AddonKind kind) {
        Set<String> names = new TreeSet<>();
        hosts.keySet().forEach(key -> {
            if (key.kind() == kind) {
                names.add(key.name());
            }
        });
        return names;
    }

    /**
     * 实例化一个已注册的 Addon。
     *
     * @throws UnknownAddonException 未注册
     */
    public AddonInstance<?> instantiate(AddonKind kind, String name, String instanceName,
            Map<String, Object> config) {
        AddonHost<?> host = hosts.get(new AddonKey(kind, name));
        if (host == null) {
            throw new UnknownAddonException(kind.getValue(), name);
        }
        log.debug("实例化 Addon {}:{} -> {}", kind.getValue(), name, instanceName);
        return host.instantiate(instanceName, config);
    }

    /**
     * 带类型检查的实例化，实例类型不符时销毁实例并抛出异常。
     */
    @SuppressWarnings("unchecked")
    public <T> AddonInstance<T> instantiate(AddonKind kind, String name, String instanceName,
            Map<String, Object> config, Class<T> type) {
        AddonInstance<?> handle = instantiate(kind, name, instanceName, config);
        if (!type.isInstance(handle.getInstance())) {
            handle.destroy();
            throw new TenException(TenErrorCode.INVALID_ARGUMENT,
                    "Addon %s:%s produced %s, expected %s".formatted(kind.getValue(), name,
                            handle.getInstance().getClass().getName(), type.getName()));
        }
        return (AddonInstance<T>) handle;
    }

    private record AddonKey(AddonKind kind, String name) {
    }
}
