package com.tenframework.runtime.addon.foreign;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.tenframework.runtime.addon.AddonKind;
import com.tenframework.runtime.addon.AddonManifest;
import com.tenframework.runtime.addon.AddonRegistry;
import com.tenframework.runtime.common.TenException;
import com.tenframework.runtime.engine.Engine;
import com.tenframework.runtime.graph.GraphConnection;
import com.tenframework.runtime.graph.GraphDefinition;
import com.tenframework.runtime.graph.GraphNode;
import com.tenframework.runtime.graph.MessageFlow;
import com.tenframework.runtime.message.Command;
import com.tenframework.runtime.message.CommandResult;
import com.tenframework.runtime.message.StatusCode;
import com.tenframework.runtime.testing.RecordingExtension;
import com.tenframework.runtime.testing.TestGraphs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tenframework.runtime.testing.TestGraphs.APP_URI;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ForeignExtensionAddon测试")
class ForeignExtensionAddonTest {

    private static final String MANIFEST = """
            {
              "type": "extension",
              "name": "native_adder",
              "version": "0.1.0",
              "api": {
                "property": {"threshold": {"type": "int32"}},
                "cmd_in": [
                  {"name": "add", "property": {"count": {"type": "int32"}}, "required": ["count"]}
                ]
              }
            }
            """;

    private AddonRegistry registry;
    private RecordingExtension sender;
    private FakeFactory factory;
    private Engine engine;

    /**
     * 记录调用的原生句柄，收到 add 命令时返回 {reply: count}
     */
    private static final class FakeHandle implements NativeExtensionHandle {
        private final List<Map<String, Object>> messages = new CopyOnWriteArrayList<>();
        private final AtomicInteger destroyed = new AtomicInteger();
        private volatile NativeHost host;

        @Override
        public void onInit(NativeHost host) {
            this.host = host;
        }

        @Override
        @SuppressWarnings("unchecked")
        public void onMessage(Map<String, Object> message) {
            messages.add(message);
            Map<String, Object> properties = (Map<String, Object>) message.get("properties");
            host.returnResult((Long) message.get("command_id"), "ok", true,
                    Map.of("reply", properties.get("count")));
        }

        @Override
        public void destroy() {
            destroyed.incrementAndGet();
        }
    }

    private static final class FakeFactory implements NativeAddonFactory {
        private final AtomicInteger moduleLoads = new AtomicInteger();
        private final AtomicReference<Map<String, Object>> config = new AtomicReference<>();
        private final FakeHandle handle = new FakeHandle();

        @Override
        public void onModuleLoad() {
            moduleLoads.incrementAndGet();
        }

        @Override
        public NativeExtensionHandle create(String instanceName, Map<String, Object> config) {
            this.config.set(config);
            return handle;
        }
    }

    @BeforeEach
    void setUp() {
        registry = new AddonRegistry();
        sender = TestGraphs.registerRecording(registry, new RecordingExtension("sender"));
        factory = new FakeFactory();
        ForeignExtensionAddon.register(registry, "native_adder", factory, AddonManifest.fromJson(MANIFEST));
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
    }

    private void startEngine() throws InterruptedException {
        GraphDefinition definition = new GraphDefinition()
                .setGraphId("foreign-" + UUID.randomUUID())
                .addNode(GraphNode.extension("sender", "sender", "G1"))
                .addNode(GraphNode.extension("adder", "native_adder", "G2")
                        .setProperty(Map.of("threshold", "7")))
                .addConnection(GraphConnection.from("sender").addCmd(MessageFlow.of("add", "adder")));
        engine = new Engine(APP_URI, definition, registry);
        engine.start();
        assertTrue(sender.awaitStarted());
    }

    private CommandResult send(Command command) throws Exception {
        CompletableFuture<CommandResult> future = sender.call(env -> env.sendCommand(command));
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("按 manifest 编组属性并把原生侧的结果送回发送方")
    void testCommandRoundTripThroughNativeHandle() throws Exception {
        startEngine();
        Command add = Command.create("add");
        add.setProperty("count", "3");

        CommandResult result = send(add);

        assertEquals(StatusCode.OK, result.getStatusCode());
        assertEquals(3, result.getProperty("reply"));
        assertEquals(add.getCommandId(), result.getInResponseTo());
        assertEquals(1, factory.handle.messages.size());
        Map<String, Object> marshaled = factory.handle.messages.get(0);
        assertEquals("cmd", marshaled.get("type"));
        assertEquals("add", marshaled.get("name"));
        assertEquals(7, factory.config.get().get("threshold"));
        assertEquals(1, factory.moduleLoads.get());
    }

    @Test
    @DisplayName("缺少必填属性时直接返回 ERROR，不调用原生句柄")
    void testMissingRequiredPropertyReturnsError() throws Exception {
        startEngine();

        CommandResult result = send(Command.create("add"));

        assertEquals(StatusCode.ERROR, result.getStatusCode());
        assertTrue(result.getDetail().contains("count"));
        assertTrue(factory.handle.messages.isEmpty());
    }

    @Test
    @DisplayName("Engine 停止后原生句柄恰好销毁一次")
    void testHandleDestroyedOnceOnStop() throws Exception {
        startEngine();

        engine.stop();
        engine.stop();

        assertEquals(1, factory.handle.destroyed.get());
    }

    @Test
    @DisplayName("模块加载失败时不注册")
    void testModuleLoadFailure() {
        NativeAddonFactory broken = new NativeAddonFactory() {
            @Override
            public void onModuleLoad() throws Exception {
                throw new IllegalStateException("missing symbol");
            }

            @Override
            public NativeExtensionHandle create(String instanceName, Map<String, Object> config) {
                return null;
            }
        };

        assertThrows(TenException.class, () -> ForeignExtensionAddon.register(registry, "broken", broken, null));
        assertFalse(registry.isRegistered(AddonKind.EXTENSION, "broken"));
    }

    @Test
    @DisplayName("销毁后再调用句柄抛出 IllegalStateException")
    void testCallAfterDestroy() {
        FakeHandle handle = new FakeHandle();
        ForeignExtension extension = new ForeignExtension("x", handle, null, new PropertyMarshaller());

        extension.destroy();
        extension.destroy();

        assertTrue(extension.isDestroyed());
        assertEquals(1, handle.destroyed.get());
        assertThrows(IllegalStateException.class, () -> extension.onStart(null));
    }

    @Test
    @DisplayName("另一个线程并发调用同一句柄时被拒绝")
    void testConcurrentCallRejected() throws Exception {
        CountDownLatch inInit = new CountDownLatch(1);
        CountDownLatch releaseInit = new CountDownLatch(1);
        NativeExtensionHandle blocking = new NativeExtensionHandle() {
            @Override
            public void onInit(NativeHost host) throws Exception {
                inInit.countDown();
                releaseInit.await(5, TimeUnit.SECONDS);
            }

            @Override
            public void onMessage(Map<String, Object> message) {
            }

            @Override
            public void destroy() {
            }
        };
        ForeignExtension extension = new ForeignExtension("x", blocking, null, new PropertyMarshaller());

        CompletableFuture<Void> init = CompletableFuture.runAsync(() -> {
            try {
                extension.onInit(null);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(inInit.await(5, TimeUnit.SECONDS));

        assertThrows(IllegalStateException.class, () -> extension.onStart(null));

        releaseInit.countDown();
        init.get(5, TimeUnit.SECONDS);
        assertDoesNotThrow(() -> extension.onStart(null));
    }
}
