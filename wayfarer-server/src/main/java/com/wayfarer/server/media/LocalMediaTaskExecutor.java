package com.wayfarer.server.media;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 进程内执行器：提交到 mediaTaskExecutor 线程池，只执行一次，不重试。
 * 队列已满时任务直接记为 failed。
 */
@Component
@ConditionalOnProperty(prefix = "wayfarer.media", name = "executor", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalMediaTaskExecutor implements MediaTaskExecutor {

    public static final String MODE = "local";

    private final ThreadPoolExecutor mediaTaskExecutor;
    private final MediaTaskRunner mediaTaskRunner;

    public LocalMediaTaskExecutor(@Qualifier("mediaTaskExecutor") ThreadPoolExecutor mediaTaskExecutor,
                                  MediaTaskRunner mediaTaskRunner) {
        this.mediaTaskExecutor = mediaTaskExecutor;
        this.mediaTaskRunner = mediaTaskRunner;
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public void submit(String taskId, MediaTaskPayload payload) {
        try {
            mediaTaskExecutor.execute(() -> {
                try {
                    mediaTaskRunner.run(MODE, taskId, payload, 1, true);
                } catch (Exception e) {
                    log.error("本地媒体任务执行异常: taskId={}", taskId, e);
                    mediaTaskRunner.fail(MODE, taskId, 1, "internal error");
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("本地媒体任务队列已满，任务记为失败: taskId={}, queued={}", taskId, mediaTaskExecutor.getQueue().size());
            mediaTaskRunner.fail(MODE, taskId, 1, "media task queue is full");
        }
    }
}
