package com.wayfarer.server.controller.user;

import com.wayfarer.common.context.BaseContext;
import com.wayfarer.common.properties.PlannerProperties;
import com.wayfarer.common.result.ErrorCode;
import com.wayfarer.common.result.Result;
import com.wayfarer.pojo.dto.TravelChatRequestDTO;
import com.wayfarer.pojo.vo.AgentResponseVO;
import com.wayfarer.pojo.vo.MediaStatusVO;
import com.wayfarer.server.ai.TravelPlanOrchestrator;
import com.wayfarer.server.limit.SimpleRateLimiter;
import com.wayfarer.server.media.MediaAssets;
import com.wayfarer.server.media.MediaTaskRecord;
import com.wayfarer.server.media.MediaTaskService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import javax.validation.Valid;

/**
 * 旅行规划对话与媒体任务查询接口，登录与否都可调用。
 */
@RestController
@RequestMapping("/user/travel")
@Slf4j
@RequiredArgsConstructor
public class TravelController {

    private final TravelPlanOrchestrator travelPlanOrchestrator;
    private final MediaTaskService mediaTaskService;
    private final SimpleRateLimiter simpleRateLimiter;
    private final PlannerProperties plannerProperties;

    /**
     * 规划对话：每个用户（游客按 IP）每分钟限 5 次。
     * message 为空时由参数校验拦截，见 GlobalExceptionHandler。
     */
    @PostMapping("/chat")
    public Result<AgentResponseVO> chat(@Valid @RequestBody TravelChatRequestDTO dto, HttpServletRequest request) {
        String identify = BaseContext.callerKey(clientIp(request));
        if (!simpleRateLimiter.tryAcquire("travel:chat", identify, 60, plannerProperties.getChatRateLimitPerMinute())) {
            log.info("规划对话触发限流: identify={}", identify);
            return Result.error(ErrorCode.RATE_LIMITED);
        }
        return Result.success(travelPlanOrchestrator.run(dto.getMessage(), dto.getContext()));
    }

    @GetMapping("/media-status/{taskId}")
    public Result<MediaStatusVO> mediaStatus(@PathVariable("taskId") String taskId) {
        MediaTaskRecord record = mediaTaskService.getStatus(taskId);
        if (record == null) {
            return Result.error(ErrorCode.MEDIA_TASK_NOT_FOUND);
        }
        MediaStatusVO vo = new MediaStatusVO();
        vo.setTaskId(record.getTaskId());
        vo.setStatus(record.getStatus() == null ? null : record.getStatus().getCode());
        MediaAssets assets = record.getResult();
        if (assets != null) {
            vo.setPosterUrl(assets.getPosterUrl());
            vo.setVideoUrl(assets.getVideoUrl());
        }
        vo.setError(record.getError());
        vo.setUpdatedAt(record.getUpdatedAt());
        return Result.success(vo);
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
