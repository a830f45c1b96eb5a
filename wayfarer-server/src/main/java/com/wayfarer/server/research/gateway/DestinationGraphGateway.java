package com.wayfarer.server.research.gateway;

import java.util.List;
import java.util.Map;

/**
 * 目的地图谱查询（相似目的地、周边景点、与兴趣相关的地点）。
 */
public interface DestinationGraphGateway {

    /**
     * @param query     目的地或自由文本
     * @param interests 兴趣标签，可为空
     * @param limit     最多返回条数
     * @return 目的地列表；查询失败时抛出运行时异常
     */
    List<Map<String, Object>> findDestinations(String query, List<String> interests, int limit);
}
