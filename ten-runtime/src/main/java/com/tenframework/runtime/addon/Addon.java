package com.tenframework.runtime.addon;

import java.util.Map;

/**
 * 所有可注册工厂的统一契约，对应 C 语言中的 ten_addon_t。
 * 实现按 (kind, name) 注册到 {@link AddonRegistry}，每次实例化调用一次
 * {@link #onCreateInstance}，实例销毁时调用且只调用一次 {@link #onDestroyInstance}。
 *
 * @param <T> 产出的实例类型
 */
public interface Addon<T> {

    /**
     * 创建实例。抛出的异常会原样传播给调用 {@link AddonRegistry#instantiate} 的一方。
     *
     * @param env          该 Addon 的环境句柄
     * @param instanceName 实例名称（例如图中的 extension 名）
     * @param config       节点上配置的 property，可能为空
     */
    T onCreateInstance(AddonEnv env, String instanceName, Map<String, Object> config) throws Exception;

    default void onDestroyInstance(AddonEnv env, T instance) throws Exception {
    }

    default AddonScope scope() {
        return AddonScope.PROTOTYPE;
    }
}
