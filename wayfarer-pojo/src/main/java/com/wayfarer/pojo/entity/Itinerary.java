package com.wayfarer.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 用户保存的行程。
 * Saved itinerary, optionally linked to a background media task via {@code mediaTaskId}.
 */
@Data
@TableName("itinerary")
public class Itinerary {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long userId;

    private String title;

    private String destination;

    private LocalDate startDate;

    private LocalDate endDate;

    /**
     * 完整行程方案 JSON（TripPlanVO 序列化结果）。
     */
    private String planJson;

    /**
     * 生成海报 / 视频的后台任务 ID，可为空；media_task_id 上有普通索引。
     */
    private String mediaTaskId;

    /**
     * pending / generating / completed / failed
     */
    private String mediaStatus;

    private String posterUrl;

    private String videoUrl;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;
}
