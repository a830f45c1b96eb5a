package com.wayfarer.common.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一响应体 {code, msg, data}。
 * 业务失败同样返回 HTTP 200，由 code 区分；只有 token 校验失败直接返回 401。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result<T> {

    /** 0 表示成功，非 0 见 {@link ErrorCode} */
    private Integer code;

    private String msg;

    private T data;

    public static <T> Result<T> success(T data) {
        return new Result<>(ErrorCode.SUCCESS.getCode(), ErrorCode.SUCCESS.getMsg(), data);
    }

    public static <T> Result<T> error(String msg) {
        return error(ErrorCode.COMMON_ERROR.getCode(), msg);
    }

    public static <T> Result<T> error(ErrorCode errorCode) {
        return error(errorCode.getCode(), errorCode.getMsg());
    }

    /**
     * 在错误码默认提示后追加具体原因，例如 "请求参数不合法: message is required"。
     */
    public static <T> Result<T> error(ErrorCode errorCode, String detail) {
        if (detail == null || detail.isBlank()) {
            return error(errorCode);
        }
        return error(errorCode.getCode(), errorCode.getMsg() + ": " + detail);
    }

    public static <T> Result<T> error(int code, String msg) {
        return new Result<>(code, msg, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code != null && code == ErrorCode.SUCCESS.getCode();
    }
}
