package com.wayfarer.server.media;

/**
 * 媒体任务记录存储：按 taskId 整条读写，带过期时间。
 */
public interface MediaTaskStore {

    /**
     * 整条写入记录。
     *
     * @return false 表示已有终态记录，本次写入被拒绝
     */
    boolean save(MediaTaskRecord record);

    /**
     * @return 记录不存在或已过期时返回 null
     */
    MediaTaskRecord get(String taskId);
}
