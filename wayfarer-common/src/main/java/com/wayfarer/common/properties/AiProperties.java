package com.wayfarer.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 推理服务（OpenAI 兼容 Chat Completion 接口）配置。
 * Reasoning service configuration (OpenAI compatible API).
 */
@Data
@ConfigurationProperties(prefix = "wayfarer.ai")
public class AiProperties {

    /**
     * Chat Completion 接口完整地址，例如：https://api.openai.com/v1/chat/completions
     */
    private String baseUrl;

    /**
     * API Key。
     */
    private String apiKey;

    /**
     * 模型名称，例如：gpt-4.1-mini。
     */
    private String model;

    /**
     * 连接超时（毫秒）。
     */
    private int connectTimeoutMs = 2000;

    /**
     * 单次请求超时（毫秒）。行程合成的输出较长，默认值比普通问答大。
     */
    private int requestTimeoutMs = 30000;

    /**
     * 最大重试次数（不含首次请求），仅对 429/5xx/超时生效。
     */
    private int maxRetries = 3;

    /**
     * 429 限流退避的基准时长（毫秒），第 n 次重试等待 base * 2^(n-1)。
     * 5xx 与超时不退避，直接重试。
     */
    private long rateLimitBackoffMs = 5000L;
}
