package com.wayfarer.server.ai.profile;

import com.wayfarer.pojo.dto.TravelerProfileDTO;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 画像步骤的输出。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResult {

    /** 命中问候语快速通道，未调用推理服务 */
    public static final String STATUS_GREETED = "greeted";

    /** 推理服务返回了可解析的增量并已合并 */
    public static final String STATUS_PROFILE_UPDATED = "profile_updated";

    /** 推理服务失败或输出无法解析，画像保持不变 */
    public static final String STATUS_ERROR_PARSING_LLM = "error_parsing_llm";

    private TravelerProfileDTO profile;

    /**
     * 本轮抽取到的变化，例如 "interests: hiking"。
     */
    private List<String> extractionSummary;

    private List<String> followUpQuestions;

    private String status;
}
