package com.wayfarer.common.constant;

/**
 * itinerary.media_status 字段取值。
 */
public class MediaStatusConstant {

    private MediaStatusConstant() {
    }

    /** 保存时未关联媒体任务 */
    public static final String PENDING = "pending";

    /** 已关联任务，任务尚未结束 */
    public static final String GENERATING = "generating";

    public static final String COMPLETED = "completed";

    public static final String FAILED = "failed";
}
