package com.wayfarer.server.media;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfarer.common.exception.MediaGenerationException;
import com.wayfarer.server.utils.AiClient;
import com.wayfarer.server.utils.LlmJsonParser;
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
class CreativeDirectorTest {

    @Mock
    private AiClient aiClient;

    @Mock
    private MediaGenerationClient mediaGenerationClient;

    private CreativeDirector director;

    @BeforeEach
    void setUp() {
        director = new CreativeDirector(aiClient, new LlmJsonParser(new ObjectMapper()), mediaGenerationClient);
    }

    @Test
    void produce_shouldUseConceptPrompts_andPassPosterToVideo() {
        when(aiClient.chat(anyString(), anyString(), any())).thenReturn(
                "{\"poster_prompt\": \"P\", \"video_prompt\": \"V\", \"mood\": \"dreamy\"}");
        when(mediaGenerationClient.generatePoster("P")).thenReturn("https://cdn/p.png");
        when(mediaGenerationClient.generateVideo("V", "https://cdn/p.png")).thenReturn("https://cdn/v.mp4");

        MediaAssets assets = director.produce("t1", payload());

        assertEquals("https://cdn/p.png", assets.getPosterUrl());
        assertEquals("https://cdn/v.mp4", assets.getVideoUrl());
        assertEquals("dreamy", assets.getMood());
    }

    @Test
    void produce_shouldFallBackToLocalPrompts_whenConceptUnavailable() {
        when(aiClient.chat(anyString(), anyString(), any())).thenReturn(null);
        when(mediaGenerationClient.generatePoster(anyString())).thenReturn("https://cdn/p.png");
        when(mediaGenerationClient.generateVideo(anyString(), eq("https://cdn/p.png"))).thenReturn(null);

        MediaAssets assets = director.produce("t2", payload());

        assertEquals("https://cdn/p.png", assets.getPosterUrl());
        assertNull(assets.getVideoUrl());
        verify(mediaGenerationClient).generatePoster(contains("Santorini"));
    }

    @Test
    void produce_shouldKeepVideo_whenPosterFails() {
        when(aiClient.chat(anyString(), anyString(), any())).thenReturn(null);
        when(mediaGenerationClient.generatePoster(anyString())).thenThrow(new MediaGenerationException("poster 500"));
        when(mediaGenerationClient.generateVideo(anyString(), isNull())).thenReturn("https://cdn/v.mp4");

        MediaAssets assets = director.produce("t3", payload());

        assertNull(assets.getPosterUrl());
        assertEquals("https://cdn/v.mp4", assets.getVideoUrl());
    }

    @Test
    void produce_shouldThrow_whenNoAssetProduced() {
        when(aiClient.chat(anyString(), anyString(), any())).thenReturn(null);
        when(mediaGenerationClient.generatePoster(anyString())).thenThrow(new MediaGenerationException("poster 500"));
        when(mediaGenerationClient.generateVideo(anyString(), any())).thenReturn(null);

        MediaGenerationException e = assertThrows(MediaGenerationException.class,
                () -> director.produce("t4", payload()));
        assertEquals("poster 500", e.getMessage());
    }

    @Test
    void localConcept_shouldUseDestinationAndThemes() {
        CreativeDirector.Concept concept = CreativeDirector.localConcept(payload());

        assertTrue(concept.posterPrompt.contains("Santorini"));
        assertTrue(concept.videoPrompt.contains("Oia sunset"));
        assertEquals("relaxed journey", concept.mood);
    }

    private static MediaTaskPayload payload() {
        MediaTaskPayload payload = new MediaTaskPayload();
        payload.setDestination("Santorini");
        payload.setDayThemes(List.of("Oia sunset", "Volcano hike"));
        payload.setTravelStyle("relaxed");
        return payload;
    }
}
