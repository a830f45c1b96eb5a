package com.wayfarer.common.exception;

import com.wayfarer.common.result.ErrorCode;

/**
 * 统一的业务异常类型，由全局异常处理器转换为 {@code Result.error(code, msg)}。
 * <p>表示预期内的业务失败；系统级故障直接走兜底处理。</p>
 */
public class BaseException extends RuntimeException {

    /**
     * 业务错误码；未指定时使用通用错误码。
     */
    private final Integer code;

    public BaseException(String message) {
        super(message);
        this.code = ErrorCode.COMMON_ERROR.getCode();
    }

    public BaseException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.code = errorCode.getCode();
    }

    public BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.code = errorCode.getCode();
    }

    public BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.code = errorCode.getCode();
    }

    public Integer getCode() {
        return code;
    }
}
