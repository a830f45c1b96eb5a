package com.wayfarer.pojo.dto;

import com.wayfarer.pojo.vo.TripPlanVO;
import lombok.Data;

import javax.validation.constraints.NotNull;

/**
 * 保存行程请求体。
 */
@Data
public class ItinerarySaveDTO {

    private String destination;

    @NotNull(message = "plan is required")
    private TripPlanVO plan;

    /**
     * 规划接口返回的 mediaHandle.taskId，可为空。
     */
    private String mediaTaskId;
}
