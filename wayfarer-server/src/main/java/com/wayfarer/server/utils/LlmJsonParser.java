package com.wayfarer.server.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 解析 LLM 返回的 JSON 文本。
 *
 * 模型经常把 JSON 包在 ```json ... ``` 代码块里，或在前后夹带说明文字，
 * 这里先去掉代码块围栏，再截取第一个 '{' 到最后一个 '}' 之间的内容。
 * 解析失败统一返回 null，不抛异常。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmJsonParser {

    private final ObjectMapper objectMapper;

    public JsonNode parseObject(String raw) {
        String json = extractJson(raw);
        if (json == null) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject() ? node : null;
        } catch (Exception e) {
            log.warn("解析 LLM JSON 失败: {}", e.getMessage());
            return null;
        }
    }

    public <T> T parse(String raw, Class<T> type) {
        JsonNode node = parseObject(raw);
        if (node == null) {
            return null;
        }
        return convert(node, type);
    }

    public <T> T convert(JsonNode node, Class<T> type) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (Exception e) {
            log.warn("LLM JSON 映射为 {} 失败: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    static String extractJson(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstLineEnd = text.indexOf('\n');
            text = firstLineEnd < 0 ? "" : text.substring(firstLineEnd + 1);
            int fenceEnd = text.lastIndexOf("```");
            if (fenceEnd >= 0) {
                text = text.substring(0, fenceEnd);
            }
            text = text.trim();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }
}
