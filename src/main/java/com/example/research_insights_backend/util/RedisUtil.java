package com.example.research_insights_backend.util;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Redis工具类，值统一以 JSON 字符串存储
 */
@Component
public class RedisUtil {

    @Autowired
    private RedisTemplate<String, String> redisTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * 设置缓存，带过期时间（对象版本）
     * @param key 缓存key
     * @param value 缓存对象
     * @param timeout 过期时间
     * @param unit 时间单位
     */
    public void setObject(String key, Object value, long timeout, TimeUnit unit) {
        try {
            String jsonValue = objectMapper.writeValueAsString(value);
            redisTemplate.opsForValue().set(key, jsonValue, timeout, unit);
        } catch (Exception e) {
            throw new RuntimeException("序列化对象失败", e);
        }
    }

    /**
     * 获取缓存
     * @param key 缓存key
     * @return 缓存值
     */
    public String get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    /**
     * 获取缓存列表
     * @param key 缓存key
     * @param elementType 元素类型
     * @return 列表，缓存不存在时返回null
     */
    public <T> List<T> getList(String key, Class<T> elementType) {
        String value = get(key);
        if (value == null) {
            return null;
        }
        try {
            JavaType type = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
            return objectMapper.readValue(value, type);
        } catch (Exception e) {
            throw new RuntimeException("反序列化对象失败", e);
        }
    }

    /**
     * 删除缓存
     * @param key 缓存key
     * @return 是否删除成功
     */
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }
}
