package com.wayfarer.server.research.provider;

import java.util.Locale;

/**
 * 礼宾调研源可执行的操作（封闭集合）。
 * 推理服务给出的工具名先解码为枚举，未知名称统一落到 FALLBACK。
 */
public enum ConciergeTool {

    SEARCH_HOTELS("search_hotels"),

    SEARCH_PLACES("search_places"),

    /** 推理失败或工具名无法识别：按目的地做一次通用地点检索 */
    FALLBACK("fallback");

    private final String code;

    ConciergeTool(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ConciergeTool fromCode(String code) {
        if (code == null) {
            return FALLBACK;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ConciergeTool tool : values()) {
            if (tool != FALLBACK && tool.code.equals(normalized)) {
                return tool;
            }
        }
        return FALLBACK;
    }
}
