package com.tenframework.runtime.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * 所有消息类型的抽象基类，对齐C/Python中的ten_msg_t结构体。
 * 不可变的信封（id、name、source）加上可变的属性表。
 */
@Getter
public abstract class Message {

    protected long id;

    protected String name;

    /**
     * 进入路由器时由发送方的环境设置
     */
    protected Location srcLoc;

    // 查找与插入顺序无关，序列化时保留插入顺序
    protected Map<String, Object> properties;

    protected long timestamp;

    protected Message(String name) {
        this.id = MessageUtils.generateUniqueId();
        this.name = name;
        this.properties = new LinkedHashMap<>();
        this.timestamp = System.currentTimeMillis();
    }

    /**
     * 拷贝构造函数，属性表深拷贝
     */
    protected Message(Message other, boolean keepId) {
        this.id = keepId ? other.id : MessageUtils.generateUniqueId();
        this.name = other.name;
        this.srcLoc = other.srcLoc != null ? other.srcLoc.copy() : null;
        this.properties = MessageUtils.deepCopyMap(other.properties);
        this.timestamp = other.timestamp;
    }

    public abstract MessageType getType();

    /**
     * 生成一个与原消息完全独立的副本。
     *
     * @param keepId true 时保留原 ID，false 时分配新 ID
     */
    public abstract Message copy(boolean keepId);

    public void setSrcLoc(Location srcLoc) {
        this.srcLoc = srcLoc;
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Object getProperty(String key) {
        return properties.get(key);
    }

    public <T> Optional<T> getProperty(String key, Class<T> type) {
        return Optional.ofNullable(MessageUtils.getTypedValue(properties, key, type, null));
    }

    public Message setProperty(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("属性名不能为空");
        }
        if (value == null) {
            properties.remove(key);
        } else {
            properties.put(key, value);
        }
        return this;
    }

    public Message setProperties(Map<String, Object> values) {
        if (values != null) {
            values.forEach(this::setProperty);
        }
        return this;
    }

    public boolean hasProperty(String key) {
        return properties.containsKey(key);
    }

    public Object removeProperty(String key) {
        return properties.remove(key);
    }

    @Override
    public String toString() {
        return "%s{id=%d, name='%s', src=%s}".formatted(getType().getValue(), id, name, srcLoc);
    }
}
