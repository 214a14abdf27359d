package com.tenframework.runtime.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.tenframework.runtime.addon.Addon;
import com.tenframework.runtime.addon.AddonKind;
import com.tenframework.runtime.addon.AddonRegistry;
import com.tenframework.runtime.common.GraphException;
import com.tenframework.runtime.common.StartupFailedException;
import com.tenframework.runtime.common.UnknownAddonException;
import com.tenframework.runtime.extension.Extension;
import com.tenframework.runtime.extension.ExtensionGroupHook;
import com.tenframework.runtime.extension.TenEnvProxy;
import com.tenframework.runtime.graph.GraphConnection;
import com.tenframework.runtime.graph.GraphDefinition;
import com.tenframework.runtime.graph.GraphNode;
import com.tenframework.runtime.graph.MessageFlow;
import com.tenframework.runtime.message.Command;
import com.tenframework.runtime.message.CommandResult;
import com.tenframework.runtime.message.Data;
import com.tenframework.runtime.message.FanInPolicy;
import com.tenframework.runtime.message.Message;
import com.tenframework.runtime.message.StatusCode;
import com.tenframework.runtime.runloop.EventLoop;
import com.tenframework.runtime.runloop.ExecutorEventLoop;
import com.tenframework.runtime.testing.RecordingExtension;
import com.tenframework.runtime.testing.TestGraphs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.tenframework.runtime.testing.TestGraphs.APP_URI;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Engine 端到端测试：启停顺序、路由、结果关联和拆除时的 ABORTED。
 * 基础图：A(G1)、B(G2)、C(G3)、plain(G3)，A 的连接见 {@link #baseGraph}。
 */
@DisplayName("Engine测试")
class EngineTest {

    private AddonRegistry registry;
    private List<String> events;
    private RecordingExtension a;
    private RecordingExtension b;
    private RecordingExtension c;
    private Engine engine;
    private String graphId;

    @BeforeEach
    void setUp() {
        registry = new AddonRegistry();
        events = Collections.synchronizedList(new ArrayList<>());
        a = TestGraphs.registerRecording(registry, new RecordingExtension("A", events));
        b = TestGraphs.registerRecording(registry, new RecordingExtension("B", events));
        c = TestGraphs.registerRecording(registry, new RecordingExtension("C", events));
        TestGraphs.registerInstance(registry, "plain", new Extension() {
        });
        graphId = "engine-test-" + UUID.randomUUID();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
    }

    private GraphDefinition baseGraph() {
        Map<String, Object> greeting = new LinkedHashMap<>();
        greeting.put("text", "hi");
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("greeting", greeting);
        properties.put("retries", 3);

        return new GraphDefinition()
                .setGraphId(graphId)
                .addNode(GraphNode.extension("A", "A", "G1").setProperty(properties))
                .addNode(GraphNode.extension("B", "B", "G2"))
                .addNode(GraphNode.extension("C", "C", "G3"))
                .addNode(GraphNode.extension("plain", "plain", "G3"))
                .addConnection(GraphConnection.from("A")
                        .addCmd(MessageFlow.of("ping", "B"))
                        .addCmd(MessageFlow.of("both", "B", "C"))
                        .addCmd(MessageFlow.of("unsupported", "plain"))
                        .addData(MessageFlow.of("seq", "B")));
    }

    private Engine startEngine(GraphDefinition definition) {
        engine = new Engine(APP_URI, definition, registry);
        engine.start();
        return engine;
    }

    @Test
    @DisplayName("跨分组的命令往返：结果在发送方线程上恰好回调一次")
    void testPingAcrossGroups() throws Exception {
        startEngine(baseGraph());
        assertEquals(EngineState.RUNNING, engine.getState());

        List<CommandResult> results = new CopyOnWriteArrayList<>();
        List<String> resultThreads = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        Command ping = Command.create("ping");

        assertTrue(a.run(env -> env.sendCommand(ping, (resultEnv, result) -> {
            results.add(result);
            resultThreads.add(Thread.currentThread().getName());
            done.countDown();
        })));

        assertTrue(done.await(5, TimeUnit.SECONDS), "应在超时前收到结果");
        Thread.sleep(100);

        assertEquals(1, results.size(), "结果回调只应被调用一次");
        CommandResult result = results.get(0);
        assertEquals(StatusCode.OK, result.getStatusCode());
        assertEquals(ping.getCommandId(), result.getInResponseTo());
        assertTrue(result.isFinal());
        assertEquals(a.getLoopThreadName(), resultThreads.get(0), "结果应在 A 的分组线程上回调");

        assertEquals(1, b.getReceived().size());
        Message delivered = b.getReceived().get(0);
        assertEquals("A", delivered.getSrcLoc().getExtensionName());
        assertEquals("G1", delivered.getSrcLoc().getExtensionGroup());
        assertEquals(b.getLoopThreadName(), b.getHandlerThreads().get(0));
        assertNotEquals(a.getLoopThreadName(), b.getLoopThreadName());
        assertTrue(c.getReceived().isEmpty(), "C 没有连接，不应收到消息");
    }

    @Test
    @DisplayName("没有路由的命令在 sendCommand 返回前同步收到 NO_ROUTE")
    void testNoRouteIsSynchronous() throws Exception {
        startEngine(baseGraph());

        CommandResult result = a.call(env -> {
            AtomicReference<CommandResult> captured = new AtomicReference<>();
            env.sendCommand(Command.create("nobody_listens"), (resultEnv, r) -> captured.set(r));
            return captured.get();
        });

        assertNotNull(result, "NO_ROUTE 应在 sendCommand 内同步回调");
        assertEquals(StatusCode.NO_ROUTE, result.getStatusCode());
        assertEquals(1, engine.getRouterMetrics().getCommandsNoRoute().getCount());
    }

    @Test
    @DisplayName("没有路由的数据消息被丢弃并计数")
    void testUnroutedDataIsDropped() throws Exception {
        startEngine(baseGraph());

        Boolean sent = a.call(env -> env.sendData(Data.create("nowhere")));

        assertFalse(sent);
        assertEquals(1, engine.getRouterMetrics().getMessagesDropped().getCount());
    }

    @Test
    @DisplayName("同一发送方发往同一目的地的消息保持 FIFO")
    void testFifoOrdering() throws Exception {
        startEngine(baseGraph());

        a.run(env -> {
            for (int i = 0; i < 200; i++) {
                Data data = Data.create("seq");
                data.setProperty("n", i);
                env.sendData(data);
            }
        });

        assertTrue(b.awaitReceived(200, 5000));
        for (int i = 0; i < 200; i++) {
            assertEquals(i, b.getReceived().get(i).getProperty("n"), "第 " + i + " 条消息乱序");
        }
    }

    @Test
    @DisplayName("发送后修改原消息不影响已发出的快照")
    void testSenderMutationAfterSendIsInvisible() throws Exception {
        startEngine(baseGraph());

        a.run(env -> {
            Data data = Data.create("seq");
            data.setProperty("n", 1);
            env.sendData(data);
            data.setProperty("n", 999);
        });

        assertTrue(b.awaitReceived(1, 5000));
        assertEquals(1, b.getReceived().get(0).getProperty("n"));
    }

    @Test
    @DisplayName("停止 Engine 时在途命令的发送方恰好收到一次 ABORTED，且早于自身 onStop")
    void testPendingCommandAbortedOnStop() throws Exception {
        b.setCommandBehavior((command, env) -> {
            // 永不返回结果
        });
        startEngine(baseGraph());

        List<CommandResult> results = new CopyOnWriteArrayList<>();
        a.run(env -> env.sendCommand(Command.create("ping"), (resultEnv, result) -> {
            results.add(result);
            events.add("A:result:" + result.getStatusCode());
        }));
        assertTrue(b.awaitReceived(1, 5000));

        engine.stop();

        assertEquals(EngineState.STOPPED, engine.getState());
        assertEquals(1, results.size());
        assertEquals(StatusCode.ABORTED, results.get(0).getStatusCode());
        assertTrue(events.indexOf("A:result:ABORTED") < events.indexOf("A:onStop"),
                "ABORTED 应在 A 的 onStop 之前送达: " + events);
        assertEquals(1, engine.getRouterMetrics().getCommandsAborted().getCount());
    }

    @Test
    @DisplayName("stop 完成后进入 STOPPED，通知所有者，并从存活 Engine 列表移除")
    void testStopReachesStoppedAndNotifiesOwner() throws Exception {
        List<Engine> stoppedEngines = new CopyOnWriteArrayList<>();
        EngineOwner owner = new EngineOwner() {
            @Override
            public void onStopGraphRequested(Engine requester) {
            }

            @Override
            public void onCloseAppRequested(Engine requester) {
            }

            @Override
            public void onEngineStopped(Engine stopped) {
                stoppedEngines.add(stopped);
            }
        };
        engine = new Engine(APP_URI, baseGraph(), registry, new EngineConfig(), owner);
        engine.start();
        assertTrue(Engine.liveEngines().contains(engine));
        // 让各队列里留有未处理的消息
        a.run(env -> {
            for (int i = 0; i < 50; i++) {
                env.sendData(Data.create("seq"));
            }
        });

        engine.stop();

        assertEquals(EngineState.STOPPED, engine.getState());
        assertEquals(List.of(engine), stoppedEngines);
        assertFalse(Engine.liveEngines().contains(engine));
        assertTrue(TestGraphs.waitUntil(() -> TestGraphs.countThreads(graphId) == 0, 5000),
                "停止后不应残留线程");
    }

    @Test
    @DisplayName("中间节点转发收到的命令：每一跳有独立的关联 ID，结果逐跳返回给最初的发送方")
    void testForwardedCommandResultReturnsToOrigin() throws Exception {
        b.setCommandBehavior((command, env) -> env.sendCommand(command, (resultEnv, result) -> {
            CommandResult relayed = CommandResult.create(result.getStatusCode(), command);
            relayed.setProperty("via", "B");
            resultEnv.returnResult(relayed);
        }));
        GraphDefinition definition = new GraphDefinition()
                .setGraphId(graphId)
                .addNode(GraphNode.extension("A", "A", "G1"))
                .addNode(GraphNode.extension("B", "B", "G2"))
                .addNode(GraphNode.extension("C", "C", "G3"))
                .addConnection(GraphConnection.from("A").addCmd(MessageFlow.of("relay", "B")))
                .addConnection(GraphConnection.from("B").addCmd(MessageFlow.of("relay", "C")));
        startEngine(definition);

        Command relay = Command.create("relay");
        CompletableFuture<CommandResult> future = a.call(env -> env.sendCommand(relay));
        CommandResult result = future.get(5, TimeUnit.SECONDS);

        assertEquals(StatusCode.OK, result.getStatusCode());
        assertEquals("B", result.getProperty("via"));
        assertEquals(relay.getCommandId(), result.getInResponseTo());
        assertEquals(1, c.getReceived().size());
        Command atC = (Command) c.getReceived().get(0);
        assertNotEquals(relay.getCommandId(), atC.getCommandId(), "转发出去的命令应使用新的关联 ID");
        assertEquals("B", atC.getSrcLoc().getExtensionName());
        assertEquals(0, engine.getRouterMetrics().getResultsStale().getCount());
    }

    @Test
    @DisplayName("onStop 中发出的命令在拆除时恰好收到一次 ABORTED")
    void testCommandSentDuringStopIsAborted() throws Exception {
        b.setCommandBehavior((command, env) -> {
            // 永不返回结果
        });
        List<CommandResult> results = new CopyOnWriteArrayList<>();
        a.setStopAction(env -> env.sendCommand(Command.create("ping"),
                (resultEnv, result) -> results.add(result)));
        startEngine(baseGraph());

        engine.stop();

        assertEquals(EngineState.STOPPED, engine.getState());
        assertEquals(1, results.size(), "停止过程中发出的命令应恰好结清一次: " + results);
        assertEquals(StatusCode.ABORTED, results.get(0).getStatusCode());
        assertEquals("ping", results.get(0).getName());
    }

    @Test
    @DisplayName("引用未声明节点的图启动失败，不创建任何线程")
    void testInvalidGraphCreatesNoThreads() {
        GraphDefinition definition = new GraphDefinition()
                .setGraphId(graphId)
                .addNode(GraphNode.extension("A", "A", "G1"))
                .addConnection(GraphConnection.from("A").addCmd(MessageFlow.of("ping", "ghost")));
        Engine bad = new Engine(APP_URI, definition, registry);

        GraphException e = assertThrows(GraphException.class, bad::start);

        assertTrue(e.getOffendingElement().contains("dest"), e.getOffendingElement());
        assertTrue(e.getMessage().contains("ghost"));
        assertEquals(EngineState.CREATED, bad.getState());
        assertEquals(0, TestGraphs.countThreads(graphId));
        assertTrue(events.isEmpty(), "不应实例化任何 Extension");
    }

    @Test
    @DisplayName("引用未注册 Addon 的图启动失败")
    void testUnknownAddon() {
        GraphDefinition definition = new GraphDefinition()
                .setGraphId(graphId)
                .addNode(GraphNode.extension("A", "A", "G1"))
                .addNode(GraphNode.extension("X", "not_registered", "G2"));
        Engine bad = new Engine(APP_URI, definition, registry);

        UnknownAddonException e = assertThrows(UnknownAddonException.class, bad::start);

        assertTrue(e.getMessage().contains("not_registered"));
        assertEquals(0, TestGraphs.countThreads(graphId));
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("onStart 失败时 Engine 完整拆除并抛出 StartupFailedException")
    void testStartupFailureTearsDown() throws Exception {
        b.setStartFailure(new IllegalStateException("boom"));
        Engine failing = new Engine(APP_URI, baseGraph(), registry);

        assertThrows(StartupFailedException.class, failing::start);

        assertEquals(EngineState.STOPPED, failing.getState());
        // 已启动的 Extension 正常停止，B 只执行了 onInit，因此只有 onDeinit
        assertTrue(events.contains("A:onStop"));
        assertTrue(events.contains("A:onDeinit"));
        assertTrue(events.contains("C:onStop"));
        assertTrue(events.contains("B:onDeinit"));
        assertFalse(events.contains("B:onStop"));
        assertTrue(TestGraphs.waitUntil(() -> TestGraphs.countThreads(graphId) == 0, 5000),
                "拆除后不应残留线程");
    }

    @Test
    @DisplayName("生命周期按 configure、init、start 分阶段推进，停止时逆序执行")
    void testLifecycleOrdering() {
        startEngine(baseGraph());
        engine.stop();

        for (RecordingExtension ext : List.of(a, b, c)) {
            String n = ext.getName();
            assertTrue(events.indexOf(n + ":onConfigure") < events.indexOf(n + ":onInit"));
            assertTrue(events.indexOf(n + ":onInit") < events.indexOf(n + ":onStart"));
            assertTrue(events.indexOf(n + ":onStart") < events.indexOf(n + ":onStop"));
            assertTrue(events.indexOf(n + ":onStop") < events.indexOf(n + ":onDeinit"));
        }
    }

    @Test
    @DisplayName("重复调用 stop 没有任何效果")
    void testStopIsIdempotent() {
        startEngine(baseGraph());

        engine.stop();
        engine.stop();

        assertEquals(EngineState.STOPPED, engine.getState());
        assertEquals(1, events.stream().filter("A:onStop"::equals).count());
        assertEquals(1, events.stream().filter("A:onDeinit"::equals).count());

        Engine neverStarted = new Engine(APP_URI, baseGraph(), registry);
        neverStarted.stop();
        assertEquals(EngineState.STOPPED, neverStarted.getState());
    }

    @Test
    @DisplayName("不能在 Engine 自己的分组线程上同步调用 stop")
    void testStopFromGroupThreadRejected() throws Exception {
        Engine running = startEngine(baseGraph());

        Throwable error = a.call(env -> {
            try {
                running.stop();
                return null;
            } catch (IllegalStateException e) {
                return e;
            }
        });

        assertInstanceOf(IllegalStateException.class, error);
        assertEquals(EngineState.RUNNING, running.getState());
    }

    @Test
    @DisplayName("Extension 请求 stopGraph 后 Engine 异步停止")
    void testStopGraphRequestedByExtension() throws Exception {
        startEngine(baseGraph());

        a.run(env -> env.stopGraph());

        assertTrue(TestGraphs.waitUntil(() -> engine.getState() == EngineState.STOPPED, 5000));
        assertTrue(events.contains("A:onStop"));
    }

    @Test
    @DisplayName("FIRST_WINS：扇出到两个目的地，只回调第一个结果，第二个记为 StaleResult")
    void testFanOutFirstWins() throws Exception {
        startEngine(baseGraph());

        List<CommandResult> results = new CopyOnWriteArrayList<>();
        Command both = Command.create("both");
        a.run(env -> env.sendCommand(both, (resultEnv, result) -> results.add(result)));

        assertTrue(b.awaitReceived(1, 5000));
        assertTrue(c.awaitReceived(1, 5000));
        assertTrue(TestGraphs.waitUntil(
                () -> engine.getRouterMetrics().getResultsStale().getCount() == 1, 5000));
        Thread.sleep(50);

        assertEquals(1, results.size());
        Command toB = (Command) b.getReceived().get(0);
        Command toC = (Command) c.getReceived().get(0);
        assertNotEquals(toB.getId(), toC.getId(), "扇出副本应分配新的消息 ID");
        assertEquals(both.getCommandId(), toB.getCommandId());
        assertEquals(both.getCommandId(), toC.getCommandId());
    }

    @Test
    @DisplayName("WAIT_FOR_ALL：收齐两个目的地的结果后命令才结清")
    void testFanOutWaitForAll() throws Exception {
        startEngine(baseGraph());

        List<CommandResult> results = new CopyOnWriteArrayList<>();
        Command both = Command.create("both").setFanInPolicy(FanInPolicy.WAIT_FOR_ALL);
        a.run(env -> env.sendCommand(both, (resultEnv, result) -> results.add(result)));

        assertTrue(TestGraphs.waitUntil(() -> results.size() == 2, 5000));
        Thread.sleep(50);

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(r -> r.getStatusCode() == StatusCode.OK));
        assertEquals(0, engine.getRouterMetrics().getResultsStale().getCount());
    }

    @Test
    @DisplayName("流式结果：非最终结果逐个回调，最终结果结清命令")
    void testStreamingResults() throws Exception {
        b.setCommandBehavior((command, env) -> {
            for (int i = 0; i < 2; i++) {
                CommandResult partial = CommandResult.ok(command).setFinal(false);
                partial.setProperty("chunk", i);
                env.returnResult(partial);
            }
            env.returnResult(CommandResult.ok(command));
        });
        startEngine(baseGraph());

        List<CommandResult> results = new CopyOnWriteArrayList<>();
        a.run(env -> env.sendCommand(Command.create("ping"), (resultEnv, result) -> results.add(result)));

        assertTrue(TestGraphs.waitUntil(() -> results.size() == 3, 5000));
        assertFalse(results.get(0).isFinal());
        assertEquals(0, results.get(0).getProperty("chunk"));
        assertFalse(results.get(1).isFinal());
        assertTrue(results.get(2).isFinal());

        CompletableFuture<CommandResult> future = a.call(env -> env.sendCommand(Command.create("ping")));
        CommandResult finalResult = future.get(5, TimeUnit.SECONDS);
        assertTrue(finalResult.isFinal(), "Future 只应以最终结果完成");
    }

    @Test
    @DisplayName("命令处理器抛出异常时发送方收到 ERROR")
    void testHandlerExceptionBecomesError() throws Exception {
        b.setCommandBehavior((command, env) -> {
            throw new IllegalArgumentException("bad input");
        });
        startEngine(baseGraph());

        CompletableFuture<CommandResult> future = a.call(env -> env.sendCommand(Command.create("ping")));
        CommandResult result = future.get(5, TimeUnit.SECONDS);

        assertEquals(StatusCode.ERROR, result.getStatusCode());
        assertTrue(result.getDetail().contains("bad input"));
    }

    @Test
    @DisplayName("已返回最终结果后再抛异常，不会产生第二个结果")
    void testExceptionAfterReturnDoesNotDuplicate() throws Exception {
        b.setCommandBehavior((command, env) -> {
            env.returnResult(CommandResult.ok(command));
            throw new IllegalStateException("late failure");
        });
        startEngine(baseGraph());

        List<CommandResult> results = new CopyOnWriteArrayList<>();
        a.run(env -> env.sendCommand(Command.create("ping"), (resultEnv, result) -> results.add(result)));

        assertTrue(TestGraphs.waitUntil(() -> results.size() == 1, 5000));
        Thread.sleep(100);
        assertEquals(1, results.size());
        assertEquals(StatusCode.OK, results.get(0).getStatusCode());
        assertEquals(0, engine.getRouterMetrics().getResultsStale().getCount());
    }

    @Test
    @DisplayName("未实现 onCommand 的 Extension 返回 ERROR")
    void testDefaultOnCommandReturnsError() throws Exception {
        startEngine(baseGraph());

        CompletableFuture<CommandResult> future = a.call(env -> env.sendCommand(Command.create("unsupported")));
        CommandResult result = future.get(5, TimeUnit.SECONDS);

        assertEquals(StatusCode.ERROR, result.getStatusCode());
        assertTrue(result.getDetail().contains("unsupported"));
    }

    @Test
    @DisplayName("在非所属线程上调用 TenEnv 会抛出 IllegalStateException")
    void testEnvRejectsForeignThread() {
        startEngine(baseGraph());

        assertThrows(IllegalStateException.class,
                () -> a.getEnv().sendCommand(Command.create("ping"), null));
        assertThrows(IllegalStateException.class, () -> a.getEnv().getProperties());
    }

    @Test
    @DisplayName("节点属性可按路径读取和修改")
    void testEnvProperties() throws Exception {
        startEngine(baseGraph());

        assertEquals("hi", a.call(env -> env.getPropertyString("greeting.text", null)));
        assertEquals(3, (int) a.call(env -> env.getPropertyInt("retries", 0)));
        assertEquals("fallback", a.call(env -> env.getPropertyString("missing.path", "fallback")));

        a.call(env -> {
            env.setProperty("greeting.lang", "zh");
            return null;
        });
        assertEquals("zh", a.call(env -> env.getPropertyString("greeting.lang", null)));
    }

    @Test
    @DisplayName("定时器在所属分组线程上触发，取消后不触发")
    void testTimers() throws Exception {
        startEngine(baseGraph());

        CountDownLatch fired = new CountDownLatch(1);
        AtomicReference<String> firedOn = new AtomicReference<>();
        AtomicInteger cancelledFired = new AtomicInteger();

        a.call(env -> env.setTimer(20, () -> {
            firedOn.set(Thread.currentThread().getName());
            fired.countDown();
        }));
        a.call(env -> env.cancelTimer(env.setTimer(100, cancelledFired::incrementAndGet)));

        assertTrue(fired.await(5, TimeUnit.SECONDS));
        assertEquals(a.getLoopThreadName(), firedOn.get());
        Thread.sleep(300);
        assertEquals(0, cancelledFired.get());
    }

    @Test
    @DisplayName("代理的最后一次释放回到所属线程处理，释放后不能再投递")
    void testProxyRefCounting() throws Exception {
        startEngine(baseGraph());

        TenEnvProxy proxy = a.call(env -> env.createProxy());
        proxy.acquire();
        proxy.release();
        assertFalse(proxy.isReleased());

        CountDownLatch ran = new CountDownLatch(1);
        assertTrue(proxy.notify(env -> ran.countDown()));
        assertTrue(ran.await(5, TimeUnit.SECONDS));

        proxy.release();
        assertTrue(proxy.isReleased());
        assertThrows(IllegalStateException.class, () -> proxy.notify(env -> {
        }));
    }

    @Test
    @DisplayName("extension_group Addon 可以把分组委托给外部执行器")
    void testGroupOnForeignExecutor() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "foreign-pool");
            t.setDaemon(true);
            return t;
        });
        List<String> hookEvents = new CopyOnWriteArrayList<>();
        Addon<ExtensionGroupHook> hookAddon = (env, instanceName, config) -> new ExtensionGroupHook() {
            @Override
            public EventLoop createEventLoop(String loopName) {
                return new ExecutorEventLoop(loopName, pool);
            }

            @Override
            public void onInit(String groupName) {
                hookEvents.add("init:" + groupName);
            }

            @Override
            public void onDeinit(String groupName) {
                hookEvents.add("deinit:" + groupName);
            }
        };
        registry.register(AddonKind.EXTENSION_GROUP, "foreign_group", hookAddon);

        try {
            GraphDefinition definition = baseGraph().addNode(GraphNode.extensionGroup("G2", "foreign_group"));
            startEngine(definition);

            CompletableFuture<CommandResult> future = a.call(env -> env.sendCommand(Command.create("ping")));
            assertEquals(StatusCode.OK, future.get(5, TimeUnit.SECONDS).getStatusCode());
            assertEquals("foreign-pool", b.getHandlerThreads().get(0));

            engine.stop();
            assertEquals(List.of("init:G2", "deinit:G2"), hookEvents);
            assertTrue(events.contains("B:onDeinit"));
        } finally {
            pool.shutdownNow();
        }
    }
}
