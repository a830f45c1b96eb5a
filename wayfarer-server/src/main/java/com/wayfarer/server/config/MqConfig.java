package com.wayfarer.server.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * 媒体任务工作队列（仅 rabbit 模式启用）。
 * 消费端自行控制重投次数，超过上限的消息被拒绝后进入死信队列留档。
 */
@Configuration
@ConditionalOnProperty(prefix = "wayfarer.media", name = "executor", havingValue = "rabbit")
public class MqConfig {

    public static final String MEDIA_EXCHANGE = "WAYFARER_EXCHANGE";
    public static final String MEDIA_DL_EXCHANGE = "WAYFARER_DL_EXCHANGE";
    public static final String MEDIA_QUEUE = "WAYFARER_MEDIA_TASK_QUEUE";
    public static final String MEDIA_DLQ = "WAYFARER_MEDIA_TASK_DLQ";
    public static final String MEDIA_ROUTING_KEY = "media.task";
    public static final String MEDIA_DLQ_ROUTING_KEY = "media.task.dlq";

    @Bean
    public DirectExchange mediaExchange() {
        return new DirectExchange(MEDIA_EXCHANGE);
    }

    @Bean
    public DirectExchange mediaDlExchange() {
        return new DirectExchange(MEDIA_DL_EXCHANGE);
    }

    @Bean
    public Queue mediaTaskQueue() {
        Map<String, Object> args = new HashMap<>();
        args.put("x-dead-letter-exchange", MEDIA_DL_EXCHANGE);
        args.put("x-dead-letter-routing-key", MEDIA_DLQ_ROUTING_KEY);
        return QueueBuilder.durable(MEDIA_QUEUE)
                .withArguments(args)
                .build();
    }

    @Bean
    public Queue mediaTaskDlq() {
        return QueueBuilder.durable(MEDIA_DLQ).build();
    }

    @Bean
    public Binding bindMediaTaskQueue(Queue mediaTaskQueue, DirectExchange mediaExchange) {
        return BindingBuilder.bind(mediaTaskQueue).to(mediaExchange).with(MEDIA_ROUTING_KEY);
    }

    @Bean
    public Binding bindMediaTaskDlq(Queue mediaTaskDlq, DirectExchange mediaDlExchange) {
        return BindingBuilder.bind(mediaTaskDlq).to(mediaDlExchange).with(MEDIA_DLQ_ROUTING_KEY);
    }

    /**
     * 消息体使用 JSON，避免 Java 原生序列化。
     */
    @Bean
    public MessageConverter mediaMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
