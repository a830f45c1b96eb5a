package com.wayfarer.pojo.vo;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单日行程。date 由服务端按起始日期统一回填（yyyy-MM-dd），不信任模型输出的日期。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DayPlanVO {

    @JsonAlias("day_number")
    private Integer dayNumber;

    private String date;

    private String theme;

    @JsonAlias("time_slots")
    private List<TimeSlotVO> timeSlots = new ArrayList<>();

    @JsonAlias("total_travel_time")
    private String totalTravelTime;

    @JsonAlias("estimated_cost")
    private String estimatedCost;
}
