package com.wayfarer.server.media;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfarer.common.constant.RedisConstants;
import com.wayfarer.common.properties.MediaProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;

/**
 * 基于 Redis 的媒体任务存储。
 * 写入通过 Lua 脚本完成：已有终态记录时拒绝覆盖，否则整条 SET ... EX。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisMediaTaskStore implements MediaTaskStore {

    /**
     * 1: 写入成功；0: 已是终态，拒绝写入。
     */
    private static final DefaultRedisScript<Long> SAVE_SCRIPT;

    static {
        SAVE_SCRIPT = new DefaultRedisScript<>();
        SAVE_SCRIPT.setResultType(Long.class);
        SAVE_SCRIPT.setScriptText(""
                + "local current = redis.call('GET', KEYS[1])\n"
                + "if current then\n"
                + "  local ok, rec = pcall(cjson.decode, current)\n"
                + "  if ok and type(rec) == 'table' and (rec['status'] == 'completed' or rec['status'] == 'failed') then\n"
                + "    return 0\n"
                + "  end\n"
                + "end\n"
                + "redis.call('SET', KEYS[1], ARGV[1], 'EX', ARGV[2])\n"
                + "return 1\n");
    }

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final MediaProperties mediaProperties;

    @Override
    public boolean save(MediaTaskRecord record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化媒体任务记录失败: taskId=" + record.getTaskId(), e);
        }
        long ttl = Math.max(1L, mediaProperties.getTaskTtlSeconds());
        Long result = stringRedisTemplate.execute(
                SAVE_SCRIPT,
                Collections.singletonList(RedisConstants.MEDIA_TASK_KEY + record.getTaskId()),
                json,
                String.valueOf(ttl));
        boolean saved = result != null && result == 1L;
        if (!saved) {
            log.info("媒体任务已是终态，忽略写入: taskId={}, status={}", record.getTaskId(), record.getStatus());
        }
        return saved;
    }

    @Override
    public MediaTaskRecord get(String taskId) {
        String json = stringRedisTemplate.opsForValue().get(RedisConstants.MEDIA_TASK_KEY + taskId);
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, MediaTaskRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("媒体任务记录无法解析，按不存在处理: taskId={}, err={}", taskId, e.getMessage());
            return null;
        }
    }
}
