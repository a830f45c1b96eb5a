package com.wayfarer.server.media;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 媒体后台任务入口：登记任务并交给执行器，供查询接口读取状态。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MediaTaskService {

    private final MediaTaskStore mediaTaskStore;
    private final MediaTaskExecutor mediaTaskExecutor;

    /**
     * 先写 pending 再提交，保证提交后立刻查询也能查到记录。提交本身不等待执行。
     */
    public void enqueue(String taskId, MediaTaskPayload payload) {
        mediaTaskStore.save(MediaTaskRecord.pending(taskId));
        mediaTaskExecutor.submit(taskId, payload);
        log.info("媒体任务已登记: taskId={}, executor={}", taskId, mediaTaskExecutor.mode());
    }

    public MediaTaskRecord getStatus(String taskId) {
        return mediaTaskStore.get(taskId);
    }
}
