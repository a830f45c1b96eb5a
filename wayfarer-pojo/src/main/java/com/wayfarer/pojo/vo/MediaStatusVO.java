package com.wayfarer.pojo.vo;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 媒体任务状态查询结果。
 */
@Data
public class MediaStatusVO {

    private String taskId;

    /**
     * pending / generating / completed / failed
     */
    private String status;

    private String posterUrl;

    private String videoUrl;

    private String error;

    private LocalDateTime updatedAt;
}
