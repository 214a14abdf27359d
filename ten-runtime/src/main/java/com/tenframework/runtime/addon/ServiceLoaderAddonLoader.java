package com.tenframework.runtime.addon;

import java.util.Iterator;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import com.tenframework.runtime.common.TenException;
import lombok.extern.slf4j.Slf4j;

/**
 * 内置的 addon_loader：用 {@link ServiceLoader} 发现 classpath 上所有 {@link AddonRegistration}
 * 并依次调用。单个注册入口失败只记录日志，不影响其余入口。
 */
@Slf4j
public class ServiceLoaderAddonLoader implements AddonLoader {

    public static final String NAME = "service_loader";

    // 连续发现失败的上限
    private static final int MAX_CONSECUTIVE_FAILURES = 16;

    private final ClassLoader classLoader;

    public ServiceLoaderAddonLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * 以 SINGLETON 方式提供的工厂，同一注册表只会加载一次。
     */
    public static Addon<AddonLoader> addon() {
        return new Addon<>() {
            @Override
            public AddonLoader onCreateInstance(AddonEnv env, String instanceName, Map<String, Object> config) {
                return new ServiceLoaderAddonLoader(Thread.currentThread().getContextClassLoader());
            }

            @Override
            public AddonScope scope() {
                return AddonScope.SINGLETON;
            }
        };
    }

    @Override
    public int load(AddonRegistry registry) {
        int before = countAll(registry);
        ServiceLoader<AddonRegistration> loader = ServiceLoader.load(AddonRegistration.class, classLoader);
        Iterator<AddonRegistration> iterator = loader.iterator();
        int entries = 0;
        int failures = 0;
        while (true) {
            AddonRegistration registration;
            try {
                if (!iterator.hasNext()) {
                    break;
                }
                registration = iterator.next();
                failures = 0;
            } catch (ServiceConfigurationError e) {
                log.warn("AddonRegistration 发现失败: {}", e.getMessage());
                if (++failures >= MAX_CONSECUTIVE_FAILURES) {
                    log.error("ServiceLoaderAddonLoader: 连续 {} 次发现失败，停止加载", failures);
                    break;
                }
                continue;
            }
            try {
                registration.register(registry);
                entries++;
            } catch (TenException e) {
                log.warn("AddonRegistration {} 注册失败: {}", registration.getClass().getName(), e.getMessage());
            }
        }
        int registered = countAll(registry) - before;
        log.info("ServiceLoaderAddonLoader: 调用了 {} 个注册入口，新增 {} 个 Addon", entries, registered);
        return registered;
    }

    private static int countAll(AddonRegistry registry) {
        int total = 0;
        for (AddonKind kind : AddonKind.values()) {
            total += registry.getNames(kind).size();
        }
        return total;
    }
}
