package com.tenframework.runtime.app;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenframework.runtime.common.TenErrorCode;
import com.tenframework.runtime.common.TenException;
import com.tenframework.runtime.engine.EngineConfig;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 表示 App 的整体配置，可以包含预定义的图、日志级别等。
 * 对应 property.json 的顶层 "ten" 字段下的内容。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_URI = "localhost";

    @JsonProperty("uri")
    private String uri = DEFAULT_URI;

    /**
     * 日志配置。由宿主进程的日志后端使用，运行时本身只通过 SLF4J 输出。
     */
    @JsonProperty("log")
    private LogConfig log = new LogConfig();

    @JsonProperty("engine")
    private EngineConfig engine = new EngineConfig();

    /**
     * 预定义的图配置列表。
     * 对应 property.json 中的 "predefined_graphs" 数组。
     */
    @JsonProperty("predefined_graphs")
    private List<PredefinedGraph> predefinedGraphs = new ArrayList<>();

    /**
     * 解析完整的 property.json 文档。存在 "ten" 字段时取其内容，否则把整个文档当作 "ten" 的内容。
     */
    public static AppConfig fromPropertyJson(String json) {
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new TenException(TenErrorCode.INVALID_ARGUMENT, "Invalid property.json: " + e.getMessage(), e);
        }
    }

    public static AppConfig fromStream(InputStream in) {
        try {
            return fromTree(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new TenException(TenErrorCode.INVALID_ARGUMENT, "Invalid property.json: " + e.getMessage(), e);
        }
    }

    /**
     * 从 classpath 读取配置。
     */
    public static AppConfig fromResource(String resourcePath) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = loader.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new TenException(TenErrorCode.INVALID_ARGUMENT, "Resource not found: " + resourcePath);
            }
            return fromStream(in);
        } catch (IOException e) {
            throw new TenException(TenErrorCode.INVALID_ARGUMENT, "Cannot read " + resourcePath, e);
        }
    }

    private static AppConfig fromTree(JsonNode root) throws IOException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new AppConfig();
        }
        JsonNode ten = root.has("ten") ? root.get("ten") : root;
        return MAPPER.treeToValue(ten, AppConfig.class);
    }

    public Optional<PredefinedGraph> findPredefinedGraph(String name) {
        return predefinedGraphs.stream().filter(g -> name.equals(g.getName())).findFirst();
    }

    @Data
    @NoArgsConstructor
    @Accessors(chain = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LogConfig {

        @JsonProperty("level")
        private String level = "info";
    }
}
