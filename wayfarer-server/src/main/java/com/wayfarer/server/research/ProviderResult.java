package com.wayfarer.server.research;

import lombok.Data;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个调研源的结果。失败时 items 为空列表，status=error，从不向外抛异常。
 */
@Data
public class ProviderResult {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_PARTIAL_SUCCESS = "partial_success";
    public static final String STATUS_ERROR = "error";

    private List<Map<String, Object>> items = Collections.emptyList();

    private String status;

    /**
     * 调研源自带的附加信息，例如趋势调研的 searchedLocation、attemptsUsed。
     */
    private Map<String, Object> attributes = new HashMap<>();

    public static ProviderResult success(List<Map<String, Object>> items) {
        ProviderResult r = new ProviderResult();
        r.setItems(items == null ? Collections.emptyList() : items);
        r.setStatus(STATUS_SUCCESS);
        return r;
    }

    public static ProviderResult of(List<Map<String, Object>> items, String status) {
        ProviderResult r = success(items);
        r.setStatus(status);
        return r;
    }

    public static ProviderResult error() {
        ProviderResult r = new ProviderResult();
        r.setStatus(STATUS_ERROR);
        return r;
    }
}
