package com.wayfarer.server.ai.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfarer.common.exception.ProfileException;
import com.wayfarer.pojo.dto.TravelerProfileDTO;
import com.wayfarer.server.utils.AiClient;
import com.wayfarer.server.utils.LlmJsonParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 画像步骤：从用户本轮输入中抽取偏好，并合并进调用方回传的画像快照。
 *
 * 服务端不持有任何会话画像，每次都基于入参重建并返回新对象，因此不同用户的并发请求互不影响。
 * 问候语走快速通道，不调用推理服务。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TravelerProfileService {

    static final String GREETING_FOLLOW_UP =
            "Hello! Where would you like to go on your dream trip, and what do you enjoy doing when you travel?";
    static final String PARSE_FAILURE_FOLLOW_UP = "Could you provide more details about your trip?";
    static final String ASK_DESTINATION = "Where would you like to go?";
    static final String ASK_INTERESTS = "What kind of activities do you enjoy: food, culture, nature, nightlife?";

    private static final Set<String> GREETINGS = Set.of(
            "hi", "hello", "hey", "hiya", "howdy", "yo", "hola", "greetings",
            "good morning", "good afternoon", "good evening");

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{Punct}\\s]+$");
    private static final Pattern INNER_WHITESPACE = Pattern.compile("\\s+");

    private static final String SYSTEM_PROMPT = "You are the profiler of a travel planning assistant. "
            + "Extract travel preferences from the user's message and return ONLY a JSON object: "
            + "{\"profile\": {\"dietary_restrictions\": [], \"religious_requirements\": [], \"allergies\": [], "
            + "\"accessibility_needs\": [], \"interests\": [], \"language_preferences\": [], "
            + "\"budget_level\": \"budget|moderate|luxury\", \"travel_style\": \"\", \"group_size\": 1, "
            + "\"destination\": \"\"}, \"changes\": [], \"follow_up_questions\": []}. "
            + "Only include fields the user actually mentioned in this message; omit everything else. "
            + "The current profile is given in CONTEXT for reference.";

    private final AiClient aiClient;
    private final LlmJsonParser llmJsonParser;
    private final ObjectMapper objectMapper;

    /**
     * 从调用方上下文还原画像快照。
     * 缺失时返回默认画像；类型不对或字段非法时抛出 {@link ProfileException}。
     */
    public TravelerProfileDTO restore(Object snapshot) {
        if (snapshot == null) {
            return TravelerProfileDTO.defaults();
        }
        TravelerProfileDTO profile;
        if (snapshot instanceof TravelerProfileDTO) {
            profile = ProfileMerger.copy((TravelerProfileDTO) snapshot);
        } else if (snapshot instanceof Map) {
            try {
                profile = objectMapper.convertValue(snapshot, TravelerProfileDTO.class);
            } catch (IllegalArgumentException e) {
                throw new ProfileException("画像快照格式不正确: " + e.getMessage(), e);
            }
            if (profile == null) {
                return TravelerProfileDTO.defaults();
            }
            profile.fillDefaults();
        } else {
            throw new ProfileException("画像快照类型不支持: " + snapshot.getClass().getSimpleName(), null);
        }
        if (profile.getGroupSize() != null && profile.getGroupSize() < 1) {
            throw new ProfileException("画像快照 group_size 非法: " + profile.getGroupSize(), null);
        }
        return profile;
    }

    public ProfileResult apply(String rawInput, TravelerProfileDTO priorProfileSnapshot) {
        TravelerProfileDTO prior = priorProfileSnapshot == null
                ? TravelerProfileDTO.defaults()
                : priorProfileSnapshot;

        if (isGreeting(rawInput)) {
            log.debug("命中问候语快速通道，跳过推理服务");
            return new ProfileResult(prior, Collections.emptyList(),
                    List.of(GREETING_FOLLOW_UP), ProfileResult.STATUS_GREETED);
        }

        String reply = aiClient.chat(SYSTEM_PROMPT, "User message: " + rawInput, prior);
        JsonNode root = llmJsonParser.parseObject(reply);
        if (root == null) {
            log.warn("画像抽取失败，保持原画像: inputChars={}", rawInput == null ? 0 : rawInput.length());
            return parseFailure(prior);
        }

        JsonNode deltaNode = root.has("profile") && root.get("profile").isObject() ? root.get("profile") : root;
        TravelerProfileDTO delta = llmJsonParser.convert(deltaNode, TravelerProfileDTO.class);
        if (delta == null) {
            return parseFailure(prior);
        }

        TravelerProfileDTO merged = ProfileMerger.merge(prior, delta);
        List<String> changes = readStringArray(root.get("changes"));
        if (changes.isEmpty()) {
            changes = ProfileMerger.diff(prior, merged);
        }
        List<String> followUps = readStringArray(root.get("follow_up_questions"));
        if (followUps.isEmpty()) {
            followUps = missingInfoQuestions(merged);
        }
        log.info("画像已更新: changes={}, destination={}", changes.size(), merged.getDestination());
        return new ProfileResult(merged, changes, followUps, ProfileResult.STATUS_PROFILE_UPDATED);
    }

    /**
     * 去首尾空白、转小写、去掉末尾标点后与固定问候语集合比较。
     */
    static boolean isGreeting(String rawInput) {
        if (!StringUtils.hasText(rawInput)) {
            return false;
        }
        String normalized = rawInput.trim().toLowerCase(Locale.ROOT);
        normalized = TRAILING_PUNCTUATION.matcher(normalized).replaceAll("");
        normalized = INNER_WHITESPACE.matcher(normalized).replaceAll(" ");
        return GREETINGS.contains(normalized);
    }

    private ProfileResult parseFailure(TravelerProfileDTO prior) {
        return new ProfileResult(prior, Collections.emptyList(),
                List.of(PARSE_FAILURE_FOLLOW_UP), ProfileResult.STATUS_ERROR_PARSING_LLM);
    }

    private List<String> missingInfoQuestions(TravelerProfileDTO profile) {
        List<String> questions = new ArrayList<>();
        if (!StringUtils.hasText(profile.getDestination())) {
            questions.add(ASK_DESTINATION);
        }
        if (profile.getInterests() == null || profile.getInterests().isEmpty()) {
            questions.add(ASK_INTERESTS);
        }
        return questions;
    }

    private List<String> readStringArray(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (item.isTextual() && StringUtils.hasText(item.asText())) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }
}
