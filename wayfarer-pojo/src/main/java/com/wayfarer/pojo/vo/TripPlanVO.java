package com.wayfarer.pojo.vo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 行程合成结果。
 * Final structured plan: narrative summary, title, ordered day plans and optional blocks.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TripPlanVO {

    private String title;

    private String summary;

    private List<DayPlanVO> days = new ArrayList<>();

    /**
     * 可选：交通信息（去程 / 返程 / 市内交通），结构由合成步骤决定。
     */
    private Map<String, Object> transport;

    /**
     * 可选：住宿推荐。
     */
    private Map<String, Object> accommodation;

    private List<String> tips = new ArrayList<>();
}
