package com.wayfarer.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 行程规划编排相关配置：调研线程池、单个调研源超时、默认行程天数等。
 */
@Data
@ConfigurationProperties(prefix = "wayfarer.planner")
public class PlannerProperties {

    /** 调研线程池核心线程数 */
    private int researchCorePoolSize = 6;

    /** 调研线程池最大线程数 */
    private int researchMaxPoolSize = 12;

    /** 调研线程池队列容量 */
    private int researchQueueCapacity = 200;

    /**
     * 单个调研源的等待上限（秒）。超时的调研源按空结果处理，不影响其他调研源。
     */
    private long researchTimeoutSeconds = 60L;

    /** 未指定天数时默认生成的行程天数 */
    private int defaultTripDays = 3;

    /** 行程天数上限，调用方传入的 days 或日期跨度超过时截断 */
    private int maxTripDays = 30;

    /** 同一用户 / IP 每分钟允许的对话请求数 */
    private long chatRateLimitPerMinute = 5L;
}
