package com.wayfarer.pojo.vo;

import com.wayfarer.pojo.dto.TravelerProfileDTO;
import lombok.Data;

import java.util.Map;

/**
 * 编排器对外响应。
 * Orchestrator response: {agent, status, message, profile, data, mediaHandle}.
 *
 * status 取值：
 * - greeted / needs_info：门控未通过，message 为追问；
 * - success：完成规划，data.plan 为行程方案。
 */
@Data
public class AgentResponseVO {

    private String agent;

    private String status;

    private String message;

    /**
     * 本轮合并后的画像，调用方需在下一轮请求的 context.profile 中回传。
     */
    private TravelerProfileDTO profile;

    /**
     * plan / research / followUpQuestions / degraded 等附加数据。
     */
    private Map<String, Object> data;

    private MediaHandleVO mediaHandle;
}
