package com.wayfarer.server.media;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 媒体后台任务状态。
 * pending -> generating -> completed / failed，终态写入后不可再变更，只能随 TTL 过期。
 */
public enum MediaTaskStatus {

    /**
     * 已登记，尚未开始执行
     */
    PENDING("pending"),

    /**
     * 执行中（分布式模式下重投时也保持该状态）
     */
    GENERATING("generating"),

    /**
     * 已完成，result 非空
     */
    COMPLETED("completed"),

    /**
     * 失败，error 为错误摘要
     */
    FAILED("failed");

    private final String code;

    MediaTaskStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static MediaTaskStatus fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (MediaTaskStatus status : MediaTaskStatus.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown media task status code: " + code);
    }
}
