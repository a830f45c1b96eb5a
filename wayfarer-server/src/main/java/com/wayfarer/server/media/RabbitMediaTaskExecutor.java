package com.wayfarer.server.media;

import com.wayfarer.server.config.MqConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * 分布式执行器：把任务投递到 RabbitMQ 工作队列，由 MediaTaskListener 消费。
 * 消息体：{taskId, attempt, payload}。
 */
@Component
@ConditionalOnProperty(prefix = "wayfarer.media", name = "executor", havingValue = "rabbit")
@RequiredArgsConstructor
@Slf4j
public class RabbitMediaTaskExecutor implements MediaTaskExecutor {

    public static final String MODE = "rabbit";

    private final RabbitTemplate rabbitTemplate;

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public void submit(String taskId, MediaTaskPayload payload) {
        publish(taskId, payload, 1);
    }

    /**
     * 首次投递与重投共用。
     */
    public void publish(String taskId, MediaTaskPayload payload, int attempt) {
        Map<String, Object> message = new HashMap<>();
        message.put("taskId", taskId);
        message.put("attempt", attempt);
        message.put("payload", payload);
        rabbitTemplate.convertAndSend(MqConfig.MEDIA_EXCHANGE, MqConfig.MEDIA_ROUTING_KEY, message);
        log.info("媒体任务已投递: taskId={}, attempt={}", taskId, attempt);
    }
}
