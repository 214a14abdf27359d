package com.tenframework.runtime.testing;

import java.util.function.BooleanSupplier;

import com.tenframework.runtime.addon.Addon;
import com.tenframework.runtime.addon.AddonKind;
import com.tenframework.runtime.addon.AddonRegistry;
import com.tenframework.runtime.extension.Extension;

/**
 * 构造测试图与注册表的工具方法。
 */
public final class TestGraphs {

    public static final String APP_URI = "test://app";

    private TestGraphs() {
    }

    /**
     * 注册一个总是返回同一实例的 extension Addon
     */
    public static void registerInstance(AddonRegistry registry, String addonName, Extension extension) {
        Addon<Extension> addon = (env, instanceName, config) -> extension;
        registry.register(AddonKind.EXTENSION, addonName, addon);
    }

    /**
     * 注册 name 对应的 RecordingExtension，Addon 名与 Extension 名相同
     */
    public static RecordingExtension registerRecording(AddonRegistry registry, RecordingExtension extension) {
        registerInstance(registry, extension.getName(), extension);
        return extension;
    }

    public static boolean waitUntil(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    /**
     * 名称中包含 marker 的存活线程数
     */
    public static long countThreads(String marker) {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .filter(t -> t.getName().contains(marker))
                .count();
    }
}
