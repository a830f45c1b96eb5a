package com.wayfarer.server.research.trend;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 趋势发现循环的结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrendDiscoveryResult {

    /**
     * 成功时为产出结果的那一轮查询词；耗尽重试时回到初始查询词。
     */
    private String finalQuery;

    private List<Map<String, Object>> trends;

    private int attemptsUsed;

    /**
     * success / partial_success
     */
    private String status;

    /**
     * 实际最后一次尝试使用的查询词，便于排查放宽链路。
     */
    private String lastQueryTried;
}
