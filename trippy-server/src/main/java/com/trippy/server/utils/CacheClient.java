package com.trippy.server.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trippy.common.constant.RedisConstants;
import com.trippy.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Redis 读穿缓存工具。
 *
 * 说明：
 * - 命中直接反序列化返回；
 * - 回源结果为 null 时写入空字符串并设置短 TTL，防止缓存穿透；
 * - Redis 不可用时直接回源，缓存只是加速手段，不能让推荐请求因此失败。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheClient {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsRecorder metricsRecorder;

    public void set(String key, Object value, long time, TimeUnit unit) {
        try {
            String json = objectMapper.writeValueAsString(value);
            stringRedisTemplate.opsForValue().set(key, json, time, unit);
        } catch (JsonProcessingException e) {
            log.error("序列化缓存对象失败: key={}", key, e);
        } catch (RuntimeException e) {
            log.warn("写入缓存失败: key={}, msg={}", key, e.getMessage());
        }
    }

    public void delete(String key) {
        try {
            stringRedisTemplate.delete(key);
        } catch (RuntimeException e) {
            log.warn("删除缓存失败: key={}, msg={}", key, e.getMessage());
        }
    }

    /**
     * 缓存穿透：空值缓存防护。
     *
     * @param cacheName 指标 tag，如 candidates / item
     */
    public <R, ID> R queryWithPassThrough(
            String cacheName, String keyPrefix, ID id, Class<R> type,
            Function<ID, R> dbFallback, long time, TimeUnit unit) {
        String key = keyPrefix + id;
        String json;
        try {
            json = stringRedisTemplate.opsForValue().get(key);
        } catch (RuntimeException e) {
            log.warn("读取缓存失败，直接回源: key={}, msg={}", key, e.getMessage());
            return dbFallback.apply(id);
        }

        if (StringUtils.hasText(json)) {
            metricsRecorder.recordCacheHit(cacheName, true);
            try {
                return objectMapper.readValue(json, type);
            } catch (Exception e) {
                log.error("反序列化缓存失败，回源: key={}", key, e);
                return dbFallback.apply(id);
            }
        }
        // json 非 null 但没有内容：命中空值缓存
        if (json != null) {
            metricsRecorder.recordCacheHit(cacheName, true);
            return null;
        }

        metricsRecorder.recordCacheHit(cacheName, false);
        R r = dbFallback.apply(id);
        if (r == null) {
            try {
                stringRedisTemplate.opsForValue().set(key, "", RedisConstants.CACHE_NULL_TTL, TimeUnit.MINUTES);
            } catch (RuntimeException e) {
                log.warn("写入空值缓存失败: key={}, msg={}", key, e.getMessage());
            }
            return null;
        }
        set(key, r, time, unit);
        return r;
    }
}
