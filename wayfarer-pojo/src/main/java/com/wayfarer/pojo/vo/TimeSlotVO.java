package com.wayfarer.pojo.vo;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * 行程中的一个时间段活动。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimeSlotVO {

    /** HH:mm */
    @JsonAlias("start_time")
    private String startTime;

    @JsonAlias("end_time")
    private String endTime;

    /**
     * 例如 sightseeing / dining / transport / rest
     */
    @JsonAlias("activity_type")
    private String activityType;

    private String activity;

    private String location;

    private String notes;
}
