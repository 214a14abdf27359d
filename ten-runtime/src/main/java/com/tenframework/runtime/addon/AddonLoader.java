package com.tenframework.runtime.addon;

/**
 * addon_loader 类 Addon 产出的实例：负责把一批 Addon 注册进注册表。
 */
public interface AddonLoader {

    /**
     * @return 本次注册成功的 Addon 数
     */
    int load(AddonRegistry registry);
}
