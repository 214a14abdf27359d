package com.tenframework.runtime.graph;

import java.util.List;

import com.tenframework.runtime.message.Location;
import com.tenframework.runtime.message.MessageType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConnectionTable测试")
class ConnectionTableTest {

    private static final String APP_URI = "test://app";
    private static final String GRAPH_ID = "graph-1";

    private final GraphDefinition definition = new GraphDefinition()
            .addNode(GraphNode.extension("a", "addon_a", "G1"))
            .addNode(GraphNode.extension("b", "addon_b", "G2"))
            .addNode(GraphNode.extension("c", "addon_c", null))
            .addConnection(GraphConnection.from("a")
                    .addCmd(MessageFlow.of("ping", "b"))
                    .addData(MessageFlow.of("frames", "b", "c"))
                    .addAudioFrame(MessageFlow.of("pcm", "c")));

    private static Location from(String extension, String group) {
        return new Location(APP_URI, GRAPH_ID, group, extension);
    }

    @Test
    @DisplayName("按 (源, 类型, 名称) 解析出完整的目的地位置，保持声明顺序")
    void testResolve() {
        ConnectionTable table = ConnectionTable.build(definition, APP_URI, GRAPH_ID);

        assertEquals(List.of(new Location(APP_URI, GRAPH_ID, "G2", "b")),
                table.resolve(from("a", "G1"), MessageType.CMD, "ping"));

        List<Location> frames = table.resolve(from("a", "G1"), MessageType.DATA, "frames");
        assertEquals(2, frames.size());
        assertEquals("b", frames.get(0).getExtensionName());
        assertEquals(GraphDefinition.DEFAULT_EXTENSION_GROUP, frames.get(1).getExtensionGroup());

        assertEquals(1, table.resolve(from("a", "G1"), MessageType.AUDIO_FRAME, "pcm").size());
        assertEquals(3, table.size());
    }

    @Test
    @DisplayName("类型不同、名称不同或源不同都不匹配")
    void testNoMatch() {
        ConnectionTable table = ConnectionTable.build(definition, APP_URI, GRAPH_ID);

        assertTrue(table.resolve(from("a", "G1"), MessageType.DATA, "ping").isEmpty());
        assertTrue(table.resolve(from("a", "G1"), MessageType.CMD, "pong").isEmpty());
        assertTrue(table.resolve(from("b", "G2"), MessageType.CMD, "ping").isEmpty());
        assertTrue(table.resolve(null, MessageType.CMD, "ping").isEmpty());
    }

    @Test
    @DisplayName("解析结果不可修改")
    void testResolvedListIsImmutable() {
        ConnectionTable table = ConnectionTable.build(definition, APP_URI, GRAPH_ID);

        List<Location> destinations = table.resolve(from("a", "G1"), MessageType.CMD, "ping");

        assertThrows(UnsupportedOperationException.class, () -> destinations.add(from("x", "G9")));
    }
}
