package com.wayfarer.common.result;

/**
 * 错误码枚举。
 * <p>1xxx 通用 / 认证，2xxx 行程规划，3xxx 媒体任务。</p>
 */
public enum ErrorCode {

    SUCCESS(0, "ok"),

    /** 通用业务错误（未细分场景时的兜底） */
    COMMON_ERROR(1, "error"),

    /** 请求参数不合法（为空等） */
    INVALID_PARAM(1001, "请求参数不合法"),

    /** 需要登录的接口未携带有效 token */
    NOT_LOGGED_IN(1002, "未登录或 token 无效"),

    /** 触发限流 */
    RATE_LIMITED(1003, "请求过于频繁，请稍后再试"),

    /** 画像无法从请求上下文中还原，整个规划请求无法继续 */
    PROFILE_UNRESOLVABLE(2001, "无法解析旅行者画像，请检查请求上下文"),

    /** 媒体任务不存在或已过期 */
    MEDIA_TASK_NOT_FOUND(3001, "媒体任务不存在或已过期"),

    /** 媒体生成失败（海报 / 视频） */
    MEDIA_GENERATION_FAILED(3002, "媒体生成失败");

    private final int code;
    private final String msg;

    ErrorCode(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }
}
