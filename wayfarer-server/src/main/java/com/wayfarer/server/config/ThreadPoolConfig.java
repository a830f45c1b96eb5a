package com.wayfarer.server.config;

import com.wayfarer.common.properties.MediaProperties;
import com.wayfarer.common.properties.PlannerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置。
 * <ul>
 *   <li>researchExecutor：并行调研专用。拒绝策略 CallerRunsPolicy，队列满时由请求线程自己执行，调研不会被丢弃。</li>
 *   <li>mediaTaskExecutor：仅 local 模式下创建，执行海报 / 视频生成。拒绝策略 AbortPolicy，
 *   由调用方捕获后把任务记为 failed。</li>
 * </ul>
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    @Bean(name = "researchExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor researchExecutor(PlannerProperties properties) {
        int core = Math.max(properties.getResearchCorePoolSize(), 1);
        int max = Math.max(properties.getResearchMaxPoolSize(), core);
        log.info("初始化调研线程池: core={}, max={}, queue={}", core, max, properties.getResearchQueueCapacity());
        return new ThreadPoolExecutor(
                core,
                max,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getResearchQueueCapacity(), 1)),
                namedThreadFactory("research-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean(name = "mediaTaskExecutor", destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "wayfarer.media", name = "executor", havingValue = "local", matchIfMissing = true)
    public ThreadPoolExecutor mediaTaskExecutor(MediaProperties properties) {
        int size = Math.max(properties.getLocalPoolSize(), 1);
        log.info("初始化本地媒体任务线程池: size={}, queue={}", size, properties.getLocalQueueCapacity());
        return new ThreadPoolExecutor(
                size,
                size,
                0L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getLocalQueueCapacity(), 1)),
                namedThreadFactory("media-task-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger index = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + index.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
