package com.wayfarer.pojo.vo;

import lombok.Data;

/**
 * 保存行程后的返回信息。
 */
@Data
public class ItineraryVO {

    private Long id;

    private String title;

    private String destination;

    private String mediaTaskId;

    private String mediaStatus;

    private String posterUrl;

    private String videoUrl;
}
