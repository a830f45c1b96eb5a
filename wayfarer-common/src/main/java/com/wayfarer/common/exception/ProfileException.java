package com.wayfarer.common.exception;

import com.wayfarer.common.result.ErrorCode;

/**
 * 画像阶段的致命异常：调用方提供的画像快照无法还原。
 * 这是编排器唯一向上层抛出的异常。
 */
public class ProfileException extends BaseException {

    public ProfileException(String message, Throwable cause) {
        super(ErrorCode.PROFILE_UNRESOLVABLE, message, cause);
    }
}
