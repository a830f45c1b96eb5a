package com.wayfarer.server.research;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 并行调研的合并结果：调研源名称 -> 结果。
 * 每次编排新建，合成完成后即丢弃。
 */
@Getter
public class ResearchContext {

    private final Map<String, ProviderResult> results;

    public ResearchContext(Map<String, ProviderResult> results) {
        this.results = results == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public static ResearchContext empty() {
        return new ResearchContext(Collections.emptyMap());
    }

    public List<Map<String, Object>> items(String provider) {
        ProviderResult r = results.get(provider);
        return r == null || r.getItems() == null ? Collections.emptyList() : r.getItems();
    }

    public String status(String provider) {
        ProviderResult r = results.get(provider);
        return r == null ? ProviderResult.STATUS_ERROR : r.getStatus();
    }

    public int totalItems() {
        return results.values().stream()
                .mapToInt(r -> r.getItems() == null ? 0 : r.getItems().size())
                .sum();
    }

    /**
     * 每个调研源的状态摘要，随响应返回给调用方。
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        results.forEach((name, r) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", r.getStatus());
            entry.put("count", r.getItems() == null ? 0 : r.getItems().size());
            if (r.getAttributes() != null) {
                entry.putAll(r.getAttributes());
            }
            summary.put(name, entry);
        });
        return summary;
    }
}
