package com.wayfarer.server.media;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 媒体任务输入：从行程方案中摘取的创意素材。
 * 分布式模式下会随消息一起序列化，只放必要字段。
 */
@Data
public class MediaTaskPayload {

    private String destination;

    private String title;

    private String summary;

    /**
     * 每天的主题，按天排列。
     */
    private List<String> dayThemes = new ArrayList<>();

    private List<String> interests = new ArrayList<>();

    private String travelStyle;
}
