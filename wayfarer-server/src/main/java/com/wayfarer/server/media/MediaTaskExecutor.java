package com.wayfarer.server.media;

/**
 * 媒体任务执行器。启动时按配置二选一，调用方只依赖该接口。
 * 实现必须保证任务记录最终被写为 completed 或 failed（记录过期除外）。
 */
public interface MediaTaskExecutor {

    /**
     * 执行方式标识：local / rabbit。
     */
    String mode();

    /**
     * 提交任务后立即返回，不等待执行。
     */
    void submit(String taskId, MediaTaskPayload payload);
}
