package com.wayfarer.server.media;

import com.wayfarer.server.metrics.MetricsRecorder;
import com.wayfarer.server.service.ItineraryService;
import com.wayfarer.server.support.InMemoryMediaTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MediaTaskRunnerTest {

    @Mock
    private CreativeDirector creativeDirector;

    @Mock
    private ItineraryService itineraryService;

    @Mock
    private MetricsRecorder metricsRecorder;

    private InMemoryMediaTaskStore store;
    private MediaTaskRunner runner;

    @BeforeEach
    void setUp() {
        store = new InMemoryMediaTaskStore();
        runner = new MediaTaskRunner(store, creativeDirector, itineraryService, metricsRecorder);
    }

    @Test
    void run_shouldLeaveGenerating_andAskForRedelivery_whenNotFinalAttempt() {
        store.save(MediaTaskRecord.pending("t1"));
        when(creativeDirector.produce(eq("t1"), any())).thenThrow(new IllegalStateException("timeout"));

        boolean done = runner.run("rabbit", "t1", new MediaTaskPayload(), 1, false);

        assertFalse(done);
        assertEquals(MediaTaskStatus.GENERATING, store.get("t1").getStatus());
        assertEquals(1, store.get("t1").getAttempt());
        verifyNoInteractions(itineraryService);
    }

    @Test
    void run_shouldWriteFailed_onFinalAttempt() {
        store.save(MediaTaskRecord.pending("t2"));
        when(creativeDirector.produce(eq("t2"), any())).thenThrow(new IllegalStateException("timeout"));

        boolean done = runner.run("rabbit", "t2", new MediaTaskPayload(), 3, true);

        assertTrue(done);
        MediaTaskRecord record = store.get("t2");
        assertEquals(MediaTaskStatus.FAILED, record.getStatus());
        assertEquals("timeout", record.getError());
        assertEquals(3, record.getAttempt());
        verify(itineraryService).syncMediaByTaskId(eq("t2"), any(MediaTaskRecord.class));
        verify(metricsRecorder).recordMediaTask("rabbit", "failed");
    }

    @Test
    void run_shouldSkipWork_whenRecordAlreadyTerminal() {
        store.save(MediaTaskRecord.completed("t3", 1, new MediaAssets()));

        boolean done = runner.run("rabbit", "t3", new MediaTaskPayload(), 2, false);

        assertTrue(done);
        verifyNoInteractions(creativeDirector, itineraryService);
        assertEquals(MediaTaskStatus.COMPLETED, store.get("t3").getStatus());
    }

    @Test
    void run_shouldCompleteEvenWhenItinerarySyncFails() {
        store.save(MediaTaskRecord.pending("t4"));
        MediaAssets assets = new MediaAssets();
        assets.setVideoUrl("https://cdn.example.com/v.mp4");
        when(creativeDirector.produce(eq("t4"), any())).thenReturn(assets);
        when(itineraryService.syncMediaByTaskId(anyString(), any())).thenThrow(new IllegalStateException("db down"));

        boolean done = runner.run("local", "t4", new MediaTaskPayload(), 1, true);

        assertTrue(done);
        assertEquals(MediaTaskStatus.COMPLETED, store.get("t4").getStatus());
        assertEquals("https://cdn.example.com/v.mp4", store.get("t4").getResult().getVideoUrl());
    }

    @Test
    void fail_shouldNotOverwriteTerminalRecord() {
        store.save(MediaTaskRecord.completed("t5", 1, new MediaAssets()));

        runner.fail("local", "t5", 1, "late failure");

        assertEquals(MediaTaskStatus.COMPLETED, store.get("t5").getStatus());
        assertEquals(List.of("t5:completed"), store.writes());
        verifyNoInteractions(itineraryService);
    }
}
