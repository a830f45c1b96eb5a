package com.wayfarer.server.ai;

import com.wayfarer.common.context.BaseContext;
import com.wayfarer.common.constant.MediaStatusConstant;
import com.wayfarer.common.exception.ProfileException;
import com.wayfarer.common.properties.PlannerProperties;
import com.wayfarer.pojo.dto.TravelerProfileDTO;
import com.wayfarer.pojo.vo.AgentResponseVO;
import com.wayfarer.pojo.vo.DayPlanVO;
import com.wayfarer.pojo.vo.MediaHandleVO;
import com.wayfarer.pojo.vo.TripPlanVO;
import com.wayfarer.server.ai.profile.ProfileResult;
import com.wayfarer.server.ai.profile.TravelerProfileService;
import com.wayfarer.server.media.MediaTaskPayload;
import com.wayfarer.server.media.MediaTaskService;
import com.wayfarer.server.metrics.MetricsRecorder;
import com.wayfarer.server.research.ResearchContext;
import com.wayfarer.server.research.ResearchFanOut;
import com.wayfarer.server.research.ResearchQuery;
import com.wayfarer.server.service.ItineraryService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 行程规划编排器。
 *
 * 状态机：PROFILING -> GATE -> {EARLY_RETURN | RESEARCHING -> SYNTHESIZING -> ENQUEUING -> RESPONDED}
 * - PROFILING：从上下文还原画像并合并本轮输入，只有这里的 {@link ProfileException} 会向上抛出；
 * - GATE：无规划意图且画像没有目的地时直接返回追问，不做任何调研；
 * - RESEARCHING：并行跑全部调研源，异常按空调研结果处理；
 * - SYNTHESIZING：合成失败时使用本地兜底行程，data.degraded=true；
 * - ENQUEUING：生成 taskId 登记媒体任务后立即返回，不等待海报 / 视频。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TravelPlanOrchestrator {

    public static final String AGENT_NAME = "travel_planner";

    public static final String STATUS_NEEDS_INFO = "needs_info";
    public static final String STATUS_SUCCESS = "success";

    private final TravelerProfileService travelerProfileService;
    private final ResearchFanOut researchFanOut;
    private final ItinerarySynthesizer itinerarySynthesizer;
    private final MediaTaskService mediaTaskService;
    private final ItineraryService itineraryService;
    private final PlannerProperties plannerProperties;
    private final MetricsRecorder metricsRecorder;
    private final Clock plannerClock;

    public AgentResponseVO run(String message, Map<String, Object> context) {
        PlanContext ctx = new PlanContext();
        ctx.setMessage(message == null ? "" : message);
        ctx.setContext(context == null ? Collections.emptyMap() : context);

        AgentResponseVO response = null;
        PlanState state = PlanState.PROFILING;
        while (state != PlanState.RESPONDED) {
            switch (state) {
                case PROFILING -> {
                    profile(ctx);
                    state = PlanState.GATE;
                }
                case GATE -> state = IntentGate.shouldResearch(ctx.getMessage(), ctx.getProfile())
                        ? PlanState.RESEARCHING
                        : PlanState.EARLY_RETURN;
                case EARLY_RETURN -> {
                    response = earlyReturn(ctx);
                    metricsRecorder.recordOrchestration("early_return");
                    state = PlanState.RESPONDED;
                }
                case RESEARCHING -> {
                    research(ctx);
                    state = PlanState.SYNTHESIZING;
                }
                case SYNTHESIZING -> {
                    synthesize(ctx);
                    state = PlanState.ENQUEUING;
                }
                case ENQUEUING -> {
                    enqueueMedia(ctx);
                    response = planResponse(ctx);
                    rememberPlan(ctx);
                    metricsRecorder.recordOrchestration(ctx.isDegraded() ? "degraded" : "success");
                    state = PlanState.RESPONDED;
                }
                default -> throw new IllegalStateException("未知编排状态: " + state);
            }
        }
        return response;
    }

    private void profile(PlanContext ctx) {
        try {
            TravelerProfileDTO prior = travelerProfileService.restore(ctx.getContext().get("profile"));
            ctx.setProfileResult(travelerProfileService.apply(ctx.getMessage(), prior));
        } catch (ProfileException e) {
            metricsRecorder.recordOrchestration("profile_error");
            throw e;
        } catch (Exception e) {
            metricsRecorder.recordOrchestration("profile_error");
            throw new ProfileException("无法生成旅行者画像", e);
        }
        if (ctx.getProfile() == null) {
            metricsRecorder.recordOrchestration("profile_error");
            throw new ProfileException("无法生成旅行者画像", null);
        }
    }

    private void research(PlanContext ctx) {
        TravelerProfileDTO profile = ctx.getProfile();
        int maxDays = plannerProperties.getMaxTripDays();
        LocalDate startDate = PlanDatePatcher.resolveStartDate(ctx.getContext(), LocalDate.now(plannerClock), maxDays);
        int days = PlanDatePatcher.resolveDays(ctx.getContext(), startDate, plannerProperties.getDefaultTripDays(), maxDays);
        ctx.setStartDate(startDate);
        ctx.setDays(days);
        ctx.setDestination(StringUtils.hasText(profile.getDestination()) ? profile.getDestination().trim() : ctx.getMessage());

        ResearchQuery query = new ResearchQuery();
        query.setQuery(ctx.getDestination());
        query.setMessage(ctx.getMessage());
        query.setProfile(profile);
        query.setStartDate(startDate);
        query.setDays(days);
        try {
            ctx.setResearch(researchFanOut.research(query));
        } catch (Exception e) {
            log.warn("调研阶段异常，按空调研结果继续: destination={}, err={}", ctx.getDestination(), e.getMessage());
            ctx.setResearch(ResearchContext.empty());
        }
    }

    private void synthesize(PlanContext ctx) {
        TripPlanVO plan = null;
        try {
            plan = itinerarySynthesizer.synthesize(ctx.getProfile(), ctx.getResearch(),
                    ctx.getDestination(), ctx.getStartDate(), ctx.getDays());
        } catch (Exception e) {
            log.warn("行程合成异常，改用本地兜底行程: destination={}, err={}", ctx.getDestination(), e.getMessage());
        }
        if (plan == null) {
            plan = localPlan(ctx);
            ctx.setDegraded(true);
        }
        try {
            PlanDatePatcher.patch(plan, ctx.getStartDate());
        } catch (DateTimeException e) {
            log.warn("行程日期回填失败，保留合成结果中的日期: startDate={}, err={}", ctx.getStartDate(), e.getMessage());
        }
        ctx.setPlan(plan);
    }

    private TripPlanVO localPlan(PlanContext ctx) {
        TripPlanVO plan = null;
        try {
            plan = itinerarySynthesizer.buildLocalPlan(ctx.getProfile(), ctx.getResearch(), ctx.getDestination(), ctx.getDays());
        } catch (Exception e) {
            log.error("本地兜底行程生成失败，返回空行程: destination={}", ctx.getDestination(), e);
        }
        if (plan == null) {
            plan = new TripPlanVO();
            plan.setTitle("Trip to " + ctx.getDestination());
        }
        return plan;
    }

    private void enqueueMedia(PlanContext ctx) {
        String taskId = UUID.randomUUID().toString();
        try {
            mediaTaskService.enqueue(taskId, buildPayload(ctx));
            ctx.setMediaHandle(new MediaHandleVO(MediaStatusConstant.GENERATING, taskId));
        } catch (Exception e) {
            log.error("媒体任务登记失败，行程照常返回: taskId={}", taskId, e);
            ctx.setMediaHandle(new MediaHandleVO(MediaStatusConstant.FAILED, null));
        }
    }

    private void rememberPlan(PlanContext ctx) {
        if (!BaseContext.isGuest()) {
            itineraryService.rememberPlan(BaseContext.getCurrentId(), ctx.getPlan());
        }
    }

    private AgentResponseVO earlyReturn(PlanContext ctx) {
        ProfileResult profileResult = ctx.getProfileResult();
        List<String> questions = profileResult.getFollowUpQuestions() == null
                ? Collections.emptyList()
                : profileResult.getFollowUpQuestions();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("profileStatus", profileResult.getStatus());
        data.put("followUpQuestions", questions);
        data.put("extractionSummary", profileResult.getExtractionSummary());

        AgentResponseVO response = new AgentResponseVO();
        response.setAgent(AGENT_NAME);
        response.setStatus(STATUS_NEEDS_INFO);
        response.setMessage(questions.isEmpty() ? "Tell me more about the trip you have in mind." : String.join(" ", questions));
        response.setProfile(ctx.getProfile());
        response.setData(data);
        return response;
    }

    private AgentResponseVO planResponse(PlanContext ctx) {
        TripPlanVO plan = ctx.getPlan();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("plan", plan);
        data.put("research", ctx.getResearch().summary());
        data.put("startDate", ctx.getStartDate().toString());
        data.put("days", ctx.getDays());
        data.put("degraded", ctx.isDegraded());
        data.put("profileStatus", ctx.getProfileResult().getStatus());
        data.put("followUpQuestions", ctx.getProfileResult().getFollowUpQuestions());

        AgentResponseVO response = new AgentResponseVO();
        response.setAgent(AGENT_NAME);
        response.setStatus(STATUS_SUCCESS);
        response.setMessage(StringUtils.hasText(plan.getSummary())
                ? plan.getSummary()
                : "Here is your " + ctx.getDays() + "-day itinerary for " + ctx.getDestination() + ".");
        response.setProfile(ctx.getProfile());
        response.setData(data);
        response.setMediaHandle(ctx.getMediaHandle());
        log.info("行程规划完成: destination={}, days={}, degraded={}, researchItems={}, mediaStatus={}",
                ctx.getDestination(), ctx.getDays(), ctx.isDegraded(),
                ctx.getResearch().totalItems(), ctx.getMediaHandle().getStatus());
        return response;
    }

    private static MediaTaskPayload buildPayload(PlanContext ctx) {
        TripPlanVO plan = ctx.getPlan();
        MediaTaskPayload payload = new MediaTaskPayload();
        payload.setDestination(ctx.getDestination());
        payload.setTitle(plan.getTitle());
        payload.setSummary(plan.getSummary());
        List<String> themes = new ArrayList<>();
        if (plan.getDays() != null) {
            for (DayPlanVO day : plan.getDays()) {
                if (day != null && StringUtils.hasText(day.getTheme())) {
                    themes.add(day.getTheme());
                }
            }
        }
        payload.setDayThemes(themes);
        TravelerProfileDTO profile = ctx.getProfile();
        if (profile.getInterests() != null) {
            payload.setInterests(new ArrayList<>(profile.getInterests()));
        }
        payload.setTravelStyle(profile.getTravelStyle());
        return payload;
    }

    private enum PlanState {
        PROFILING,
        GATE,
        EARLY_RETURN,
        RESEARCHING,
        SYNTHESIZING,
        ENQUEUING,
        RESPONDED
    }

    /**
     * 单次编排的中间状态，只在本次调用内使用。
     */
    @Data
    private static class PlanContext {
        private String message;
        private Map<String, Object> context;
        private ProfileResult profileResult;
        private String destination;
        private LocalDate startDate;
        private int days;
        private ResearchContext research = ResearchContext.empty();
        private TripPlanVO plan;
        private boolean degraded;
        private MediaHandleVO mediaHandle;

        TravelerProfileDTO getProfile() {
            return profileResult == null ? null : profileResult.getProfile();
        }
    }
}
