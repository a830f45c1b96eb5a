package com.wayfarer.pojo.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 规划接口返回的媒体占位：调用方凭 taskId 轮询媒体状态或在保存行程时关联。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MediaHandleVO {

    private String status;

    private String taskId;
}
