package com.wayfarer.server.media;

import com.wayfarer.server.metrics.MetricsRecorder;
import com.wayfarer.server.service.ItineraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 媒体任务的单次执行逻辑，本地与分布式执行器共用。
 * 后台线程不保证带有 MDC，日志里显式打印 taskId。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MediaTaskRunner {

    private final MediaTaskStore mediaTaskStore;
    private final CreativeDirector creativeDirector;
    private final ItineraryService itineraryService;
    private final MetricsRecorder metricsRecorder;

    /**
     * 执行一次任务。
     *
     * @param attempt      第几次投递，从 1 开始
     * @param finalAttempt 是否最后一次；非最后一次失败时不写 failed，交给调用方重投
     * @return true 表示已写入终态（completed 或 failed），false 表示需要重投
     */
    public boolean run(String executor, String taskId, MediaTaskPayload payload, int attempt, boolean finalAttempt) {
        if (!mediaTaskStore.save(MediaTaskRecord.generating(taskId, attempt))) {
            // 已是终态（例如重复投递），视为已处理
            return true;
        }
        metricsRecorder.recordMediaTask(executor, MediaTaskStatus.GENERATING.getCode());
        long start = System.currentTimeMillis();

        MediaTaskRecord terminal;
        try {
            MediaAssets assets = creativeDirector.produce(taskId, payload);
            terminal = MediaTaskRecord.completed(taskId, attempt, assets);
            log.info("媒体任务完成: taskId={}, attempt={}, costMs={}", taskId, attempt, System.currentTimeMillis() - start);
        } catch (Exception e) {
            if (!finalAttempt) {
                log.warn("媒体任务失败，等待重投: taskId={}, attempt={}, err={}", taskId, attempt, e.getMessage());
                return false;
            }
            log.error("媒体任务最终失败: taskId={}, attempt={}", taskId, attempt, e);
            terminal = MediaTaskRecord.failed(taskId, attempt, summarize(e));
        }

        mediaTaskStore.save(terminal);
        metricsRecorder.recordMediaTask(executor, terminal.getStatus().getCode());
        syncItinerary(taskId, terminal);
        return true;
    }

    /**
     * 执行器层面的失败（提交被拒、消息非法等）直接记为 failed。
     */
    public void fail(String executor, String taskId, int attempt, String error) {
        MediaTaskRecord failed = MediaTaskRecord.failed(taskId, attempt, error);
        if (mediaTaskStore.save(failed)) {
            metricsRecorder.recordMediaTask(executor, MediaTaskStatus.FAILED.getCode());
            syncItinerary(taskId, failed);
        }
    }

    private void syncItinerary(String taskId, MediaTaskRecord record) {
        try {
            itineraryService.syncMediaByTaskId(taskId, record);
        } catch (Exception e) {
            log.warn("回写行程媒体状态失败: taskId={}, err={}", taskId, e.getMessage());
        }
    }

    private static String summarize(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getSimpleName();
        }
        return message.length() > 200 ? message.substring(0, 200) : message;
    }
}
