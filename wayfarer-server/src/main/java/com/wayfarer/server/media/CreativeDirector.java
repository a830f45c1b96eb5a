package com.wayfarer.server.media;

import com.fasterxml.jackson.databind.JsonNode;
import com.wayfarer.common.exception.MediaGenerationException;
import com.wayfarer.server.utils.AiClient;
import com.wayfarer.server.utils.LlmJsonParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * 创意总监：先让推理服务给出海报 / 视频的创意方向，再依次生成海报和视频。
 * 视频可引用海报地址作为首帧。两个产物都没有生成出来时整个任务失败。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CreativeDirector {

    private static final String SYSTEM_PROMPT = "You are the creative director of a travel brand. "
            + "Given the trip in CONTEXT, return ONLY JSON: "
            + "{\"poster_prompt\": \"\", \"video_prompt\": \"\", \"mood\": \"\"}. "
            + "The poster prompt describes one striking image; the video prompt a 10 second cinematic clip.";

    private final AiClient aiClient;
    private final LlmJsonParser llmJsonParser;
    private final MediaGenerationClient mediaGenerationClient;

    public MediaAssets produce(String taskId, MediaTaskPayload payload) {
        Concept concept = concept(payload);
        MediaAssets assets = new MediaAssets();
        assets.setMood(concept.mood);

        String posterError = null;
        try {
            assets.setPosterUrl(mediaGenerationClient.generatePoster(concept.posterPrompt));
        } catch (Exception e) {
            posterError = e.getMessage();
            log.warn("海报生成失败，继续生成视频: taskId={}, err={}", taskId, posterError);
        }

        String videoError = null;
        try {
            assets.setVideoUrl(mediaGenerationClient.generateVideo(concept.videoPrompt, assets.getPosterUrl()));
        } catch (Exception e) {
            videoError = e.getMessage();
            log.warn("视频生成失败: taskId={}, err={}", taskId, videoError);
        }

        if (!StringUtils.hasText(assets.getPosterUrl()) && !StringUtils.hasText(assets.getVideoUrl())) {
            String reason = posterError != null ? posterError : videoError;
            throw new MediaGenerationException(reason != null ? reason : "海报与视频均未生成");
        }
        return assets;
    }

    Concept concept(MediaTaskPayload payload) {
        JsonNode root = llmJsonParser.parseObject(
                aiClient.chat(SYSTEM_PROMPT, "Create the visual concept for this trip.", payload));
        Concept local = localConcept(payload);
        if (root == null) {
            return local;
        }
        Concept concept = new Concept();
        concept.posterPrompt = textOr(root, "poster_prompt", local.posterPrompt);
        concept.videoPrompt = textOr(root, "video_prompt", local.videoPrompt);
        concept.mood = textOr(root, "mood", local.mood);
        return concept;
    }

    /**
     * 推理不可用时按行程内容拼接提示词。
     */
    static Concept localConcept(MediaTaskPayload payload) {
        String destination = StringUtils.hasText(payload.getDestination()) ? payload.getDestination() : "a dream destination";
        List<String> themes = payload.getDayThemes();
        String highlights = themes == null || themes.isEmpty()
                ? "iconic landmarks"
                : String.join(", ", themes.subList(0, Math.min(3, themes.size())));
        String style = StringUtils.hasText(payload.getTravelStyle()) ? payload.getTravelStyle() : "relaxed";

        Concept concept = new Concept();
        concept.mood = style + " journey";
        concept.posterPrompt = "Travel poster of " + destination + " featuring " + highlights
                + ", vibrant colors, modern graphic style, " + style + " mood";
        concept.videoPrompt = "Cinematic travel montage in " + destination + ": " + highlights
                + ", golden hour light, smooth drone shots";
        return concept;
    }

    private static String textOr(JsonNode root, String field, String fallback) {
        String value = root.path(field).asText(null);
        return StringUtils.hasText(value) ? value : fallback;
    }

    static class Concept {
        String posterPrompt;
        String videoPrompt;
        String mood;
    }
}
