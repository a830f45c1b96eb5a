package com.wayfarer.server.research;

import com.wayfarer.pojo.dto.TravelerProfileDTO;
import lombok.Data;

import java.time.LocalDate;

/**
 * 一次调研的输入，所有调研源共享同一份，只读。
 */
@Data
public class ResearchQuery {

    /**
     * 调研主关键词：画像中的目的地，没有时退化为用户原始输入。
     */
    private String query;

    private String message;

    private TravelerProfileDTO profile;

    private LocalDate startDate;

    private int days;
}
