package com.wayfarer.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 媒体生成（海报 / 视频）及后台任务执行配置。
 */
@Data
@ConfigurationProperties(prefix = "wayfarer.media")
public class MediaProperties {

    /**
     * 后台任务执行方式：local（进程内线程池，无重试）或 rabbit（RabbitMQ 工作队列，有限重试）。
     * 启动时确定，运行期不切换。
     */
    private String executor = "local";

    /** 媒体生成服务基础地址，例如 https://media.example.com/v1 */
    private String baseUrl;

    private String apiKey;

    private String imageModel;

    private String videoModel;

    /** 单次 HTTP 请求超时（毫秒） */
    private int requestTimeoutMs = 60000;

    /** 视频任务轮询间隔（毫秒） */
    private long pollIntervalMs = 10000L;

    /** 视频任务轮询总时长上限（秒），超过即判定失败 */
    private long maxPollSeconds = 300L;

    /** 本地执行器线程数 */
    private int localPoolSize = 4;

    /** 本地执行器队列容量，满后新任务直接记为 failed */
    private int localQueueCapacity = 100;

    /** 分布式执行器的最大投递次数（含首次） */
    private int maxAttempts = 3;

    /** 任务记录 TTL（秒） */
    private long taskTtlSeconds = 3600L;
}
