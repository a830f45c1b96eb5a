package com.wayfarer.server.media;

import com.wayfarer.server.metrics.MetricsRecorder;
import com.wayfarer.server.service.ItineraryService;
import com.wayfarer.server.support.InMemoryMediaTaskStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 本地执行器下的媒体任务全流程：
 * - enqueue 后立即查询为 pending / generating，完成后为 completed 且结果非空；
 * - 完成后重复查询结果完全一致；
 * - 执行失败写 failed；线程池队列满时直接写 failed。
 */
@ExtendWith(MockitoExtension.class)
class MediaTaskServiceTest {

    @Mock
    private CreativeDirector creativeDirector;

    @Mock
    private ItineraryService itineraryService;

    @Mock
    private MetricsRecorder metricsRecorder;

    private InMemoryMediaTaskStore store;
    private ThreadPoolExecutor pool;
    private MediaTaskService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryMediaTaskStore();
        pool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.SECONDS, new ArrayBlockingQueue<>(1),
                new ThreadPoolExecutor.AbortPolicy());
        MediaTaskRunner runner = new MediaTaskRunner(store, creativeDirector, itineraryService, metricsRecorder);
        service = new MediaTaskService(store, new LocalMediaTaskExecutor(pool, runner));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void enqueue_shouldBePendingOrGeneratingImmediately_thenCompleted() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(creativeDirector.produce(eq("task-1"), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return assets();
        });

        service.enqueue("task-1", new MediaTaskPayload());

        MediaTaskRecord early = service.getStatus("task-1");
        assertNotNull(early);
        assertTrue(early.getStatus() == MediaTaskStatus.PENDING || early.getStatus() == MediaTaskStatus.GENERATING);
        assertNull(early.getResult());

        release.countDown();
        MediaTaskRecord done = awaitTerminal("task-1");

        assertEquals(MediaTaskStatus.COMPLETED, done.getStatus());
        assertEquals("https://cdn.example.com/poster.png", done.getResult().getPosterUrl());
        verify(itineraryService).syncMediaByTaskId(eq("task-1"), any(MediaTaskRecord.class));
        assertEquals(List.of("task-1:pending", "task-1:generating", "task-1:completed"), store.writes());
    }

    @Test
    void getStatus_shouldBeIdempotent_forCompletedTask() throws Exception {
        when(creativeDirector.produce(anyString(), any())).thenReturn(assets());

        service.enqueue("task-2", new MediaTaskPayload());
        MediaTaskRecord first = awaitTerminal("task-2");
        String firstJson = store.rawJson("task-2");
        MediaTaskRecord second = service.getStatus("task-2");

        assertEquals(first, second);
        assertEquals(firstJson, store.rawJson("task-2"));
    }

    @Test
    void enqueue_shouldWriteFailed_whenGenerationThrows() throws Exception {
        when(creativeDirector.produce(anyString(), any())).thenThrow(new IllegalStateException("quota exceeded"));

        service.enqueue("task-3", new MediaTaskPayload());
        MediaTaskRecord done = awaitTerminal("task-3");

        assertEquals(MediaTaskStatus.FAILED, done.getStatus());
        assertEquals("quota exceeded", done.getError());
        assertNull(done.getResult());
    }

    @Test
    void enqueue_shouldWriteFailed_whenLocalQueueIsFull() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(creativeDirector.produce(anyString(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return assets();
        });

        try {
            service.enqueue("running", new MediaTaskPayload());
            // 等第一个任务占住唯一的线程，第二个进入队列，第三个被拒绝
            awaitStatus("running", MediaTaskStatus.GENERATING);
            service.enqueue("queued", new MediaTaskPayload());
            service.enqueue("rejected", new MediaTaskPayload());

            MediaTaskRecord rejected = service.getStatus("rejected");
            assertEquals(MediaTaskStatus.FAILED, rejected.getStatus());
            assertEquals("media task queue is full", rejected.getError());
        } finally {
            release.countDown();
        }
        assertEquals(MediaTaskStatus.COMPLETED, awaitTerminal("queued").getStatus());
    }

    @Test
    void getStatus_shouldReturnNull_forUnknownTask() {
        assertNull(service.getStatus("missing"));
    }

    private MediaTaskRecord awaitTerminal(String taskId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            MediaTaskRecord record = service.getStatus(taskId);
            if (record != null && record.getStatus().isTerminal()) {
                return record;
            }
            Thread.sleep(20);
        }
        fail("任务未在预期时间内结束: " + taskId);
        return null;
    }

    private void awaitStatus(String taskId, MediaTaskStatus status) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            MediaTaskRecord record = service.getStatus(taskId);
            if (record != null && record.getStatus() == status) {
                return;
            }
            Thread.sleep(10);
        }
        fail("任务未进入状态 " + status + ": " + taskId);
    }

    private static MediaAssets assets() {
        MediaAssets assets = new MediaAssets();
        assets.setPosterUrl("https://cdn.example.com/poster.png");
        assets.setVideoUrl("https://cdn.example.com/video.mp4");
        assets.setMood("sunny");
        return assets;
    }
}
