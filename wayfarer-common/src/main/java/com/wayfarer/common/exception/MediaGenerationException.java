package com.wayfarer.common.exception;

import com.wayfarer.common.result.ErrorCode;

/**
 * 海报 / 视频生成失败（含轮询超过上限）。
 * 只会在后台任务中出现，最终体现为任务记录的 failed 状态。
 */
public class MediaGenerationException extends BaseException {

    public MediaGenerationException(String message) {
        super(ErrorCode.MEDIA_GENERATION_FAILED, message);
    }

    public MediaGenerationException(String message, Throwable cause) {
        super(ErrorCode.MEDIA_GENERATION_FAILED, message, cause);
    }
}
