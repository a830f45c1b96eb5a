package com.wayfarer.server.media;

import lombok.Data;

/**
 * 媒体任务产物。海报与视频至少有一个非空。
 */
@Data
public class MediaAssets {

    private String posterUrl;

    private String videoUrl;

    /**
     * 创意方向给出的整体氛围，例如 "sunny coastal adventure"。
     */
    private String mood;
}
