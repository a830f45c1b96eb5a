package com.wayfarer.server.research.trend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfarer.server.utils.AiClient;
import com.wayfarer.server.utils.LlmJsonParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把原始社交数据提炼为结构化趋势：
 * {"trends": [{"title", "trend_score", "description", "extracted_locations"}]}。
 * 推理失败或输出无法解析时返回空列表，由循环决定是否放宽查询。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrendSynthesizer {

    private static final String SYSTEM_PROMPT = "You are a travel trend analyst. "
            + "From the hashtags and posts in CONTEXT, identify travel trends that are actually relevant to the location. "
            + "Return ONLY JSON: {\"trends\": [{\"title\": \"\", \"trend_score\": 0.0, "
            + "\"description\": \"\", \"extracted_locations\": []}]}. "
            + "Return an empty list if nothing is relevant.";

    private static final int MAX_RAW_ITEMS = 30;

    private final AiClient aiClient;
    private final LlmJsonParser llmJsonParser;
    private final ObjectMapper objectMapper;

    public List<Map<String, Object>> synthesize(String location,
                                                List<Map<String, Object>> hashtags,
                                                List<Map<String, Object>> content) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("location", location);
        context.put("hashtags", limit(hashtags));
        context.put("content", limit(content));

        JsonNode root = llmJsonParser.parseObject(aiClient.chat(SYSTEM_PROMPT, "Location: " + location, context));
        if (root == null || !root.path("trends").isArray()) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> trends = new ArrayList<>();
        for (JsonNode node : root.get("trends")) {
            if (!node.isObject() || !node.hasNonNull("title")) {
                continue;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> trend = objectMapper.convertValue(node, Map.class);
            trends.add(trend);
        }
        return trends;
    }

    private List<Map<String, Object>> limit(List<Map<String, Object>> items) {
        if (items == null) {
            return Collections.emptyList();
        }
        return items.size() <= MAX_RAW_ITEMS ? items : items.subList(0, MAX_RAW_ITEMS);
    }
}
