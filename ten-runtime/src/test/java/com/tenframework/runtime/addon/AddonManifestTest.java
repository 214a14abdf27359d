package com.tenframework.runtime.addon;

import com.tenframework.runtime.common.TenException;
import com.tenframework.runtime.message.MessageType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AddonManifest测试")
class AddonManifestTest {

    @Test
    @DisplayName("解析 manifest.json 中的类型、依赖和消息 schema")
    void testParseManifest() {
        AddonManifest manifest = EchoAddonRegistration.loadManifest();

        assertEquals(AddonKind.EXTENSION, manifest.getType());
        assertEquals("service_echo", manifest.getName());
        assertEquals(1, manifest.getDependencies().size());
        assertEquals("string", manifest.getApi().getProperty().get("prefix").getType());

        AddonManifest.MessageSchema echo = manifest.findInput(MessageType.CMD, "echo").orElseThrow();
        assertEquals("int32", echo.getProperty().get("repeat").getType());
        assertEquals("text", echo.getRequired().get(0));
        assertTrue(manifest.findInput(MessageType.CMD, "unknown").isEmpty());
        assertTrue(manifest.findOutput(MessageType.CMD, "echo").isEmpty());
    }

    @Test
    @DisplayName("只有声明了输入 schema 的消息类型才做检查")
    void testDeclaresInputs() {
        AddonManifest manifest = EchoAddonRegistration.loadManifest();

        assertTrue(manifest.declaresInputs(MessageType.CMD));
        assertTrue(manifest.declaresInputs(MessageType.DATA));
        assertFalse(manifest.declaresInputs(MessageType.AUDIO_FRAME));
        assertFalse(manifest.declaresInputs(MessageType.CMD_RESULT));
    }

    @Test
    @DisplayName("类型不一致或 JSON 非法时报错")
    void testInvalidManifest() {
        AddonManifest manifest = EchoAddonRegistration.loadManifest();

        assertThrows(TenException.class, () -> manifest.checkMatches(AddonKind.EXTENSION_GROUP, "service_echo"));
        assertDoesNotThrow(() -> manifest.checkMatches(AddonKind.EXTENSION, "service_echo"));
        assertThrows(TenException.class, () -> AddonManifest.fromJson("{\"type\": \"no_such_kind\"}"));
        assertThrows(TenException.class, () -> AddonManifest.fromJson("{"));
    }
}
