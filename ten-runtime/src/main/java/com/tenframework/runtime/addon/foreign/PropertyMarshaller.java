package com.tenframework.runtime.addon.foreign;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tenframework.runtime.addon.AddonManifest.MessageSchema;
import com.tenframework.runtime.addon.AddonManifest.PropertySchema;
import com.tenframework.runtime.message.AudioFrame;
import com.tenframework.runtime.message.Command;
import com.tenframework.runtime.message.CommandResult;
import com.tenframework.runtime.message.Data;
import com.tenframework.runtime.message.Message;
import com.tenframework.runtime.message.MessageUtils;
import com.tenframework.runtime.message.VideoFrame;

/**
 * 在 Java 消息与交给原生侧的 Map 之间编组，并按 manifest 的 property schema 强制转换值的类型。
 * 值无法转换或缺少必填属性时抛出 {@link IllegalArgumentException}。
 */
public class PropertyMarshaller {

    public Map<String, Object> marshal(Message message, MessageSchema schema) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", message.getType().getValue());
        out.put("id", message.getId());
        out.put("name", message.getName());
        if (message instanceof Command command) {
            out.put("command_id", command.getCommandId());
        } else if (message instanceof Data data) {
            out.put("buf", copy(data.getBuf()));
        } else if (message instanceof AudioFrame frame) {
            out.put("buf", copy(frame.getBuf()));
            out.put("sample_rate", frame.getSampleRate());
            out.put("bytes_per_sample", frame.getBytesPerSample());
            out.put("samples_per_channel", frame.getSamplesPerChannel());
            out.put("number_of_channels", frame.getNumberOfChannels());
            out.put("timestamp", frame.getFrameTimestamp());
            out.put("eof", frame.isEof());
        } else if (message instanceof VideoFrame frame) {
            out.put("buf", copy(frame.getBuf()));
            out.put("width", frame.getWidth());
            out.put("height", frame.getHeight());
            out.put("pixel_format", frame.getPixelFormat());
            out.put("timestamp", frame.getFrameTimestamp());
            out.put("eof", frame.isEof());
        }
        out.put("properties", schema != null
                ? coerceProperties(message.getProperties(), schema.getProperty(), schema.getRequired())
                : MessageUtils.deepCopyMap(message.getProperties()));
        return out;
    }

    public Map<String, Object> marshalResult(CommandResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", result.getType().getValue());
        out.put("id", result.getId());
        out.put("in_response_to", result.getInResponseTo());
        out.put("status_code", result.getStatusCode().getValue());
        out.put("is_final", result.isFinal());
        if (result.getDetail() != null) {
            out.put("detail", result.getDetail());
        }
        out.put("properties", MessageUtils.deepCopyMap(result.getProperties()));
        return out;
    }

    /**
     * 按 schema 转换一组属性。schema 中未声明的属性原样（深拷贝）保留。
     */
    public Map<String, Object> coerceProperties(Map<String, Object> values, Map<String, PropertySchema> schema,
            List<String> required) {
        Map<String, Object> source = values != null ? values : Map.of();
        if (required != null) {
            for (String key : required) {
                if (!source.containsKey(key)) {
                    throw new IllegalArgumentException("Missing required property '%s'".formatted(key));
                }
            }
        }
        Map<String, Object> out = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            PropertySchema propertySchema = schema != null ? schema.get(key) : null;
            out.put(key, coerce(value, propertySchema, key));
        });
        return out;
    }

    @SuppressWarnings("unchecked")
    Object coerce(Object value, PropertySchema schema, String path) {
        if (value == null) {
            return null;
        }
        if (schema == null || schema.getType() == null) {
            return MessageUtils.deepCopyValue(value);
        }
        return switch (schema.getType()) {
            case "string" -> {
                if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                    yield String.valueOf(value);
                }
                throw mismatch(path, schema, value);
            }
            case "int8", "int16", "int32", "uint8", "uint16" -> {
                long asLong = toLong(value, schema, path);
                if (asLong < Integer.MIN_VALUE || asLong > Integer.MAX_VALUE) {
                    throw mismatch(path, schema, value);
                }
                yield (int) asLong;
            }
            case "int64", "uint32", "uint64" -> toLong(value, schema, path);
            case "float32" -> (float) toDouble(value, schema, path);
            case "float64" -> toDouble(value, schema, path);
            case "bool" -> {
                if (value instanceof Boolean b) {
                    yield b;
                }
                if ("true".equalsIgnoreCase(String.valueOf(value)) || "false".equalsIgnoreCase(String.valueOf(value))) {
                    yield Boolean.parseBoolean(String.valueOf(value));
                }
                throw mismatch(path, schema, value);
            }
            case "buf" -> {
                if (value instanceof byte[] bytes) {
                    yield copy(bytes);
                }
                if (value instanceof String s) {
                    yield s.getBytes(StandardCharsets.UTF_8);
                }
                throw mismatch(path, schema, value);
            }
            case "object" -> {
                if (!(value instanceof Map<?, ?> map)) {
                    throw mismatch(path, schema, value);
                }
                Map<String, Object> nested = new LinkedHashMap<>();
                ((Map<String, Object>) map).forEach((k, v) -> nested.put(k,
                        coerce(v, schema.getProperties() != null ? schema.getProperties().get(k) : null,
                                path + "." + k)));
                if (schema.getRequired() != null) {
                    for (String key : schema.getRequired()) {
                        if (!nested.containsKey(key)) {
                            throw new IllegalArgumentException(
                                    "Missing required property '%s.%s'".formatted(path, key));
                        }
                    }
                }
                yield nested;
            }
            case "array" -> {
                if (!(value instanceof List<?> list)) {
                    throw mismatch(path, schema, value);
                }
                List<Object> items = new ArrayList<>(list.size());
                for (int i = 0; i < list.size(); i++) {
                    items.add(coerce(list.get(i), schema.getItems(), path + "[" + i + "]"));
                }
                yield items;
            }
            default -> throw new IllegalArgumentException(
                    "Unknown schema type '%s' for property '%s'".formatted(schema.getType(), path));
        };
    }

    private static long toLong(Object value, PropertySchema schema, String path) {
        long result;
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble != Math.rint(asDouble)) {
                throw mismatch(path, schema, value);
            }
            result = number.longValue();
        } else if (value instanceof String s) {
            try {
                result = Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw mismatch(path, schema, value);
            }
        } else {
            throw mismatch(path, schema, value);
        }
        if (schema.getType().startsWith("uint") && result < 0) {
            throw mismatch(path, schema, value);
        }
        return result;
    }

    private static double toDouble(Object value, PropertySchema schema, String path) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw mismatch(path, schema, value);
            }
        }
        throw mismatch(path, schema, value);
    }

    private static IllegalArgumentException mismatch(String path, PropertySchema schema, Object value) {
        return new IllegalArgumentException("Property '%s' expects %s but got %s (%s)".formatted(path,
                schema.getType(), value, value.getClass().getSimpleName()));
    }

    private static byte[] copy(byte[] bytes) {
        return bytes != null ? Arrays.copyOf(bytes, bytes.length) : new byte[0];
    }
}
