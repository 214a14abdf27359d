package com.tenframework.runtime.message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 消息相关的工具方法。
 */
public final class MessageUtils {

    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private MessageUtils() {
    }

    /**
     * 生成进程内唯一的消息 ID，0 保留为无效值。
     */
    public static long generateUniqueId() {
        return ID_GENERATOR.getAndIncrement();
    }

    /**
     * 深拷贝属性表，嵌套的 Map、List 和 byte[] 都会被复制。
     */
    public static Map<String, Object> deepCopyMap(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> copy.put(key, deepCopyValue(value)));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    public static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopyMap((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopyValue(item));
            }
            return copy;
        }
        if (value instanceof byte[] bytes) {
            return Arrays.copyOf(bytes, bytes.length);
        }
        // String、数值、Boolean 都是不可变的
        return value;
    }

    /**
     * 按类型读取属性值，数值类型之间允许转换。
     */
    public static <T> T getTypedValue(Map<String, Object> properties, String key, Class<T> type, T defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        if (value instanceof Number number) {
            Object converted = null;
            if (type == Integer.class) {
                converted = number.intValue();
            } else if (type == Long.class) {
                converted = number.longValue();
            } else if (type == Double.class) {
                converted = number.doubleValue();
            } else if (type == Float.class) {
                converted = number.floatValue();
            }
            if (converted != null) {
                return type.cast(converted);
            }
        }
        return defaultValue;
    }
}
