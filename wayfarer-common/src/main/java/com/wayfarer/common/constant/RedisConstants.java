package com.wayfarer.common.constant;

public class RedisConstants {

    private RedisConstants() {
    }

    /** 媒体任务记录前缀 media:task:{taskId} */
    public static final String MEDIA_TASK_KEY = "media:task:";

    /** 媒体任务消费分布式锁前缀 lock:media:task:{taskId} */
    public static final String LOCK_MEDIA_TASK = "lock:media:task:";

    /** 用户最近一次行程方案缓存前缀 cache:plan:user:{userId} */
    public static final String CACHE_PLAN_KEY = "cache:plan:user:";

    /** 行程方案缓存 TTL（分钟） */
    public static final long CACHE_PLAN_TTL_MINUTES = 30L;

    /** 缓存空值 TTL（分钟） */
    public static final long CACHE_NULL_TTL = 2L;
}
