package com.wayfarer.server.limit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Redis 的固定窗口计数限流器。
 *
 * 调用方决定限流维度（userId 或 IP）。Redis 不可用时放行，
 * 限流只是防刷手段，不能反过来拖垮主流程。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimpleRateLimiter {

    private static final String PREFIX = "rl:";

    private final StringRedisTemplate stringRedisTemplate;

    /**
     * @param bizKey       业务前缀，例如 travel:chat
     * @param identify     限流维度标识，如 user:1、ip:127.0.0.1
     * @param windowSecond 时间窗口（秒）
     * @param maxCount     窗口内允许的最大次数
     * @return true 表示允许本次请求
     */
    public boolean tryAcquire(String bizKey, String identify, long windowSecond, long maxCount) {
        if (identify == null) {
            identify = "unknown";
        }
        String key = PREFIX + bizKey + ":" + identify;
        Long count;
        try {
            count = stringRedisTemplate.opsForValue().increment(key);
            if (count != null && count == 1L) {
                stringRedisTemplate.expire(key, windowSecond, TimeUnit.SECONDS);
            }
        } catch (Exception e) {
            log.warn("限流计数失败，本次放行: key={}, err={}", key, e.getMessage());
            return true;
        }
        if (count == null) {
            return true;
        }
        boolean allowed = count <= maxCount;
        if (!allowed) {
            log.warn("限流触发: bizKey={}, identify={}, windowSecond={}, maxCount={}, current={}",
                    bizKey, identify, windowSecond, maxCount, count);
        }
        return allowed;
    }
}
