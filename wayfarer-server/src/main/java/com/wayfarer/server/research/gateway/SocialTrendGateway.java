package com.wayfarer.server.research.gateway;

import java.util.List;
import java.util.Map;

/**
 * 社交媒体趋势数据源。两个方法相互独立，趋势发现循环分别调用。
 */
public interface SocialTrendGateway {

    /**
     * 与地点相关的热门话题标签。
     */
    List<Map<String, Object>> trendingHashtags(String location);

    /**
     * 与地点相关的旅行内容（帖子、短视频描述等）。
     */
    List<Map<String, Object>> searchTravelContent(String location);
}
