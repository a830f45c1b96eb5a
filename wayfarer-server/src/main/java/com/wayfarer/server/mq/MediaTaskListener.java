package com.wayfarer.server.mq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfarer.common.constant.RedisConstants;
import com.wayfarer.common.properties.MediaProperties;
import com.wayfarer.server.config.MqConfig;
import com.wayfarer.server.media.MediaTaskPayload;
import com.wayfarer.server.media.MediaTaskRecord;
import com.wayfarer.server.media.MediaTaskRunner;
import com.wayfarer.server.media.MediaTaskStore;
import com.wayfarer.server.media.RabbitMediaTaskExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 媒体任务消费者（rabbit 模式）：
 * - 每个任务加一把 Redisson 分布式锁，防止同一任务被并发消费；
 * - 记录已是终态或已过期时直接跳过，保证重复投递幂等；
 * - 失败且未到最大次数时以 attempt+1 重新投递，最后一次失败写 failed；
 * - 无法解析的消息拒绝且不重回队列，进入死信队列留档。
 */
@Component
@ConditionalOnProperty(prefix = "wayfarer.media", name = "executor", havingValue = "rabbit")
@RequiredArgsConstructor
@Slf4j
public class MediaTaskListener {

    private final MediaTaskRunner mediaTaskRunner;
    private final MediaTaskStore mediaTaskStore;
    private final RabbitMediaTaskExecutor rabbitMediaTaskExecutor;
    private final RedissonClient redissonClient;
    private final MediaProperties mediaProperties;
    private final ObjectMapper objectMapper;

    @RabbitListener(queues = MqConfig.MEDIA_QUEUE)
    public void handleMediaTask(Map<String, Object> message) {
        String taskId = message.get("taskId") == null ? null : String.valueOf(message.get("taskId"));
        Integer attempt = toInt(message.get("attempt"));
        MediaTaskPayload payload = toPayload(message.get("payload"));
        if (taskId == null || attempt == null || payload == null) {
            log.warn("非法的媒体任务消息，转入死信队列: {}", message);
            throw new AmqpRejectAndDontRequeueException("invalid media task message");
        }

        RLock lock = redissonClient.getLock(RedisConstants.LOCK_MEDIA_TASK + taskId);
        boolean locked = false;
        try {
            // 不指定租期，由看门狗续期，生成视频可能持续数分钟
            locked = lock.tryLock(1, TimeUnit.SECONDS);
            if (!locked) {
                log.warn("获取媒体任务分布式锁失败，可能正被其他消费者处理: taskId={}, attempt={}", taskId, attempt);
                return;
            }

            MediaTaskRecord current = mediaTaskStore.get(taskId);
            if (current == null) {
                log.warn("媒体任务记录不存在或已过期，跳过: taskId={}", taskId);
                return;
            }
            if (current.getStatus() != null && current.getStatus().isTerminal()) {
                log.info("媒体任务已是终态，跳过重复消息: taskId={}, status={}", taskId, current.getStatus());
                return;
            }

            boolean finalAttempt = attempt >= Math.max(1, mediaProperties.getMaxAttempts());
            boolean done;
            try {
                done = mediaTaskRunner.run(RabbitMediaTaskExecutor.MODE, taskId, payload, attempt, finalAttempt);
            } catch (Exception e) {
                log.error("媒体任务执行异常: taskId={}, attempt={}", taskId, attempt, e);
                if (finalAttempt) {
                    mediaTaskRunner.fail(RabbitMediaTaskExecutor.MODE, taskId, attempt, "internal error");
                }
                done = finalAttempt;
            }
            if (!done) {
                republish(taskId, payload, attempt);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待媒体任务分布式锁被中断: taskId={}", taskId);
        } finally {
            if (locked && lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    /**
     * 重新投递失败时直接写 failed，避免记录停留在 generating 直到过期。
     */
    private void republish(String taskId, MediaTaskPayload payload, int attempt) {
        try {
            rabbitMediaTaskExecutor.publish(taskId, payload, attempt + 1);
        } catch (AmqpException e) {
            log.error("媒体任务重新投递失败，标记为 failed: taskId={}, attempt={}", taskId, attempt, e);
            mediaTaskRunner.fail(RabbitMediaTaskExecutor.MODE, taskId, attempt, "republish failed");
        }
    }

    private MediaTaskPayload toPayload(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(value, MediaTaskPayload.class);
        } catch (IllegalArgumentException e) {
            log.warn("媒体任务 payload 无法解析: {}", e.getMessage());
            return null;
        }
    }

    private Integer toInt(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
