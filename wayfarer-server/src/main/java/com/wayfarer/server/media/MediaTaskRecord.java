package com.wayfarer.server.media;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 媒体任务记录，整条以 JSON 存于 Redis，每次写入都是整条替换。
 */
@Data
public class MediaTaskRecord {

    private String taskId;

    private MediaTaskStatus status;

    /**
     * 仅 completed 时非空。
     */
    private MediaAssets result;

    /**
     * 仅 failed 时非空。
     */
    private String error;

    /**
     * 当前执行到第几次投递（本地模式恒为 1）。
     */
    private int attempt;

    private LocalDateTime updatedAt;

    public static MediaTaskRecord pending(String taskId) {
        return of(taskId, MediaTaskStatus.PENDING, 0);
    }

    public static MediaTaskRecord generating(String taskId, int attempt) {
        return of(taskId, MediaTaskStatus.GENERATING, attempt);
    }

    public static MediaTaskRecord completed(String taskId, int attempt, MediaAssets result) {
        MediaTaskRecord record = of(taskId, MediaTaskStatus.COMPLETED, attempt);
        record.setResult(result);
        return record;
    }

    public static MediaTaskRecord failed(String taskId, int attempt, String error) {
        MediaTaskRecord record = of(taskId, MediaTaskStatus.FAILED, attempt);
        record.setError(error);
        return record;
    }

    private static MediaTaskRecord of(String taskId, MediaTaskStatus status, int attempt) {
        MediaTaskRecord record = new MediaTaskRecord();
        record.setTaskId(taskId);
        record.setStatus(status);
        record.setAttempt(attempt);
        record.setUpdatedAt(LocalDateTime.now().withNano(0));
        return record;
    }
}
