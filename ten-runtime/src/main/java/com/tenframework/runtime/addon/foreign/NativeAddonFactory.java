package com.tenframework.runtime.addon.foreign;

import java.util.Map;

/**
 * 外语言绑定层暴露给运行时的 Addon 入口。
 * {@link #onModuleLoad()} 是注册入口，模块加载时调用一次；{@link #create} 是工厂，每次实例化调用一次。
 */
public interface NativeAddonFactory {

    default void onModuleLoad() throws Exception {
    }

    /**
     * 分配一个原生实例。
     *
     * @param config 已按 manifest 的 property schema 编组过的节点配置
     * @return 不透明的原生句柄，自带销毁回调
     */
    NativeExtensionHandle create(String instanceName, Map<String, Object> config) throws Exception;
}
