package com.wayfarer.server.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfarer.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Redis JSON 缓存工具。
 *
 * 缓存只是加速手段：Redis 读写失败一律回源，不向上抛异常，也不会凭空返回数据。
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
            log.error("序列化缓存对象失败, key={}", key, e);
        } catch (Exception e) {
            log.warn("写入缓存失败, key={}: {}", key, e.getMessage());
        }
    }

    /**
     * 缓存穿透：空值缓存防护。
     * 命中空字符串视为"回源也查不到"，直接返回 null。
     */
    public <R, ID> R queryWithPassThrough(
            String keyPrefix, ID id, Class<R> type,
            Function<ID, R> dbFallback, long time, TimeUnit unit, long nullTtlMinutes) {
        String key = keyPrefix + id;
        String json;
        try {
            json = stringRedisTemplate.opsForValue().get(key);
        } catch (Exception e) {
            log.warn("读取缓存失败，直接回源, key={}: {}", key, e.getMessage());
            metricsRecorder.recordPlanCacheHit(false);
            return dbFallback.apply(id);
        }
        if (StringUtils.hasText(json)) {
            try {
                R cached = objectMapper.readValue(json, type);
                metricsRecorder.recordPlanCacheHit(true);
                return cached;
            } catch (Exception e) {
                // 缓存内容损坏时按未命中处理，回源后会被覆盖
                log.warn("反序列化缓存失败, key={}: {}", key, e.getMessage());
            }
        } else if (json != null) {
            // 空字符串：空值缓存命中
            metricsRecorder.recordPlanCacheHit(true);
            return null;
        }

        metricsRecorder.recordPlanCacheHit(false);
        R r = dbFallback.apply(id);
        if (r == null) {
            try {
                stringRedisTemplate.opsForValue().set(key, "", nullTtlMinutes, TimeUnit.MINUTES);
            } catch (Exception e) {
                log.warn("写入空值缓存失败, key={}: {}", key, e.getMessage());
            }
            return null;
        }
        set(key, r, time, unit);
        return r;
    }
}
