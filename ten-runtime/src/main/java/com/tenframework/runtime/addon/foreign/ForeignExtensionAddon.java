package com.tenframework.runtime.addon.foreign;

import java.util.Map;

import com.tenframework.runtime.addon.Addon;
import com.tenframework.runtime.addon.AddonEnv;
import com.tenframework.runtime.addon.AddonKind;
import com.tenframework.runtime.addon.AddonManifest;
import com.tenframework.runtime.addon.AddonRegistry;
import com.tenframework.runtime.common.TenErrorCode;
import com.tenframework.runtime.common.TenException;
import com.tenframework.runtime.extension.Extension;
import lombok.extern.slf4j.Slf4j;

/**
 * 把外语言的 {@link NativeAddonFactory} 适配为统一的 {@link Addon} 契约：
 * 分配原生实例、在 onConfigure 时绑定新建的环境、调用其 init，并登记只执行一次的销毁回调。
 */
@Slf4j
public class ForeignExtensionAddon implements Addon<Extension> {

    private final NativeAddonFactory factory;
    private final PropertyMarshaller marshaller;

    public ForeignExtensionAddon(NativeAddonFactory factory) {
        this(factory, new PropertyMarshaller());
    }

    public ForeignExtensionAddon(NativeAddonFactory factory, PropertyMarshaller marshaller) {
        this.factory = factory;
        this.marshaller = marshaller;
    }

    /**
     * 调用外语言模块的注册入口，然后以 extension 类注册。
     */
    public static void register(AddonRegistry registry, String name, NativeAddonFactory factory,
            AddonManifest manifest) {
        try {
            factory.onModuleLoad();
        } catch (Exception e) {
            throw new TenException(TenErrorCode.GENERIC, "Native module '%s' failed to load".formatted(name), e);
        }
        registry.register(AddonKind.EXTENSION, name, new ForeignExtensionAddon(factory), manifest);
    }

    @Override
    public Extension onCreateInstance(AddonEnv env, String instanceName, Map<String, Object> config)
            throws Exception {
        AddonManifest manifest = env.getManifest();
        Map<String, Object> marshaledConfig = manifest != null
                ? marshaller.coerceProperties(config, manifest.getApi().getProperty(), null)
                : config;
        NativeExtensionHandle handle = factory.create(instanceName, marshaledConfig);
        if (handle == null) {
            throw new TenException(TenErrorCode.GENERIC,
                    "Native factory %s returned no handle for '%s'".formatted(env, instanceName));
        }
        log.debug("原生实例已分配: {} -> {}", env, instanceName);
        return new ForeignExtension(instanceName, handle, manifest, marshaller);
    }

    @Override
    public void onDestroyInstance(AddonEnv env, Extension instance) {
        if (instance instanceof ForeignExtension foreign) {
            foreign.destroy();
        }
    }
}
