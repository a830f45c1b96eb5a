package com.wayfarer.pojo.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;

import java.util.Map;

/**
 * 对话式行程规划请求体。
 * Chat request: free text plus caller-held context (profile snapshot, dates, etc.).
 */
@Data
public class TravelChatRequestDTO {

    /**
     * 用户本轮输入。
     */
    @NotBlank(message = "message is required")
    @Size(max = 4000, message = "message must not exceed 4000 characters")
    private String message;

    /**
     * 调用方持有的上下文：profile（上一轮返回的画像）、startDate、days 等。
     * 服务端不保存会话状态，每轮由调用方回传。
     */
    private Map<String, Object> context;
}
