package com.tenframework.runtime.addon;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenframework.runtime.common.TenErrorCode;
import com.tenframework.runtime.common.TenException;
import com.tenframework.runtime.message.MessageType;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Addon 的 manifest.json。
 * 消息 schema 对路由器只是建议性的（用于诊断），对外语言绑定的属性编组则是权威的。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AddonManifest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonProperty("type")
    private AddonKind type;

    @JsonProperty("name")
    private String name;

    @JsonProperty("version")
    private String version;

    @JsonProperty("dependencies")
    private List<Dependency> dependencies = new ArrayList<>();

    @JsonProperty("api")
    private Api api = new Api();

    public static AddonManifest fromJson(String json) {
        try {
            return MAPPER.readValue(json, AddonManifest.class);
        } catch (IOException e) {
            throw new TenException(TenErrorCode.INVALID_ARGUMENT, "Invalid addon manifest: " + e.getMessage(), e);
        }
    }

    public static AddonManifest fromStream(InputStream in) {
        try {
            return MAPPER.readValue(in, AddonManifest.class);
        } catch (IOException e) {
            throw new TenException(TenErrorCode.INVALID_ARGUMENT, "Invalid addon manifest: " + e.getMessage(), e);
        }
    }

    /**
     * 校验 manifest 与注册键一致。
     */
    public void checkMatches(AddonKind kind, String addonName) {
        if (type != null && type != kind) {
            throw new TenException(TenErrorCode.INVALID_ARGUMENT,
                    "Manifest type '%s' does not match registration kind '%s'".formatted(type.getValue(),
                            kind.getValue()));
        }
        if (name != null && !name.equals(addonName)) {
            throw new TenException(TenErrorCode.INVALID_ARGUMENT,
                    "Manifest name '%s' does not match registration name '%s'".formatted(name, addonName));
        }
    }

    /**
     * 是否声明了该类型的输入 schema。未声明时任何消息都视为可接受。
     */
    public boolean declaresInputs(MessageType type) {
        List<MessageSchema> schemas = api.inputsOf(type);
        return schemas != null && !schemas.isEmpty();
    }

    public Optional<MessageSchema> findInput(MessageType type, String messageName) {
        return find(api.inputsOf(type), messageName);
    }

    public Optional<MessageSchema> findOutput(MessageType type, String messageName) {
        return find(api.outputsOf(type), messageName);
    }

    private static Optional<MessageSchema> find(List<MessageSchema> schemas, String messageName) {
        if (schemas == null) {
            return Optional.empty();
        }
        return schemas.stream().filter(s -> messageName.equals(s.getName())).findFirst();
    }

    @Data
    @NoArgsConstructor
    @Accessors(chain = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Dependency {

        @JsonProperty("type")
        private String type;

        @JsonProperty("name")
        private String name;

        @JsonProperty("version")
        private String version;
    }

    @Data
    @NoArgsConstructor
    @Accessors(chain = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Api {

        // 节点 property 的 schema
        @JsonProperty("property")
        private Map<String, PropertySchema> property = new LinkedHashMap<>();

        @JsonProperty("cmd_in")
        private List<MessageSchema> cmdIn = new ArrayList<>();

        @JsonProperty("cmd_out")
        private List<MessageSchema> cmdOut = new ArrayList<>();

        @JsonProperty("data_in")
        private List<MessageSchema> dataIn = new ArrayList<>();

        @JsonProperty("data_out")
        private List<MessageSchema> dataOut = new ArrayList<>();

        @JsonProperty("audio_frame_in")
        private List<MessageSchema> audioFrameIn = new ArrayList<>();

        @JsonProperty("audio_frame_out")
        private List<MessageSchema> audioFrameOut = new ArrayList<>();

        @JsonProperty("video_frame_in")
        private List<MessageSchema> videoFrameIn = new ArrayList<>();

        @JsonProperty("video_frame_out")
        private List<MessageSchema> videoFrameOut = new ArrayList<>();

        @JsonIgnore
        public List<MessageSchema> inputsOf(MessageType type) {
            return switch (type) {
                case CMD -> cmdIn;
                case DATA -> dataIn;
                case AUDIO_FRAME -> audioFrameIn;
                case VIDEO_FRAME -> videoFrameIn;
                case CMD_RESULT -> List.of();
            };
        }

        @JsonIgnore
        public List<MessageSchema> outputsOf(MessageType type) {
            return switch (type) {
                case CMD -> cmdOut;
                case DATA -> dataOut;
                case AUDIO_FRAME -> audioFrameOut;
                case VIDEO_FRAME -> videoFrameOut;
                case CMD_RESULT -> List.of();
            };
        }
    }

    @Data
    @NoArgsConstructor
    @Accessors(chain = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageSchema {

        @JsonProperty("name")
        private String name;

        @JsonProperty("property")
        private Map<String, PropertySchema> property = new LinkedHashMap<>();

        @JsonProperty("required")
        private List<String> required = new ArrayList<>();
    }

    /**
     * 单个属性的 schema。type 取值：string、int32、int64、float32、float64、bool、buf、object、array。
     */
    @Data
    @NoArgsConstructor
    @Accessors(chain = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PropertySchema {

        @JsonProperty("type")
        private String type;

        @JsonProperty("properties")
        private Map<String, PropertySchema> properties;

        @JsonProperty("items")
        private PropertySchema items;

        @JsonProperty("required")
        private List<String> required;

        public static PropertySchema of(String type) {
            return new PropertySchema().setType(type);
        }
    }
}
