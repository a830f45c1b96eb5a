package com.wayfarer.server.ai;

import com.wayfarer.common.context.BaseContext;
import com.wayfarer.common.exception.ProfileException;
import com.wayfarer.common.properties.PlannerProperties;
import com.wayfarer.pojo.dto.TravelerProfileDTO;
import com.wayfarer.pojo.vo.AgentResponseVO;
import com.wayfarer.pojo.vo.DayPlanVO;
import com.wayfarer.pojo.vo.TripPlanVO;
import com.wayfarer.server.ai.profile.ProfileResult;
import com.wayfarer.server.ai.profile.TravelerProfileService;
import com.wayfarer.server.media.MediaTaskPayload;
import com.wayfarer.server.media.MediaTaskService;
import com.wayfarer.server.metrics.MetricsRecorder;
import com.wayfarer.server.research.ProviderResult;
import com.wayfarer.server.research.ResearchContext;
import com.wayfarer.server.research.ResearchFanOut;
import com.wayfarer.server.research.ResearchQuery;
import com.wayfarer.server.service.ItineraryService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 编排器状态机：
 * - 门控不通过时不做任何调研与合成；
 * - 正常路径返回行程 + generating 媒体句柄；
 * - 合成失败降级为本地行程，调研异常按空结果继续，登记失败不影响行程返回；
 * - 只有画像阶段的 ProfileException 会抛出。
 */
@ExtendWith(MockitoExtension.class)
class TravelPlanOrchestratorTest {

    @Mock
    private TravelerProfileService travelerProfileService;

    @Mock
    private ResearchFanOut researchFanOut;

    @Mock
    private ItinerarySynthesizer itinerarySynthesizer;

    @Mock
    private MediaTaskService mediaTaskService;

    @Mock
    private ItineraryService itineraryService;

    @Mock
    private MetricsRecorder metricsRecorder;

    private TravelPlanOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T08:00:00Z"), ZoneOffset.UTC);
        orchestrator = new TravelPlanOrchestrator(travelerProfileService, researchFanOut, itinerarySynthesizer,
                mediaTaskService, itineraryService, new PlannerProperties(), metricsRecorder, clock);
    }

    @AfterEach
    void tearDown() {
        BaseContext.clear();
    }

    @Test
    void run_shouldReturnEarly_withoutResearchOrSynthesis_whenGateFails() {
        TravelerProfileDTO profile = TravelerProfileDTO.defaults();
        when(travelerProfileService.restore(null)).thenReturn(profile);
        when(travelerProfileService.apply("hi", profile)).thenReturn(new ProfileResult(profile,
                Collections.emptyList(), List.of("Where is your dream trip?"), ProfileResult.STATUS_GREETED));

        AgentResponseVO response = orchestrator.run("hi", new HashMap<>());

        assertEquals(TravelPlanOrchestrator.STATUS_NEEDS_INFO, response.getStatus());
        assertEquals("Where is your dream trip?", response.getMessage());
        assertEquals(ProfileResult.STATUS_GREETED, response.getData().get("profileStatus"));
        assertNull(response.getMediaHandle());
        verifyNoInteractions(researchFanOut, itinerarySynthesizer, mediaTaskService, itineraryService);
    }

    @Test
    void run_shouldResearchSynthesizeAndEnqueue_onHappyPath() {
        TravelerProfileDTO profile = profileFor("Lisbon");
        stubProfile("plan 2 days in Lisbon", profile);
        ResearchContext research = new ResearchContext(Map.of("destinations",
                ProviderResult.success(List.of(Map.of("name", "Belem")))));
        when(researchFanOut.research(any())).thenReturn(research);
        when(itinerarySynthesizer.synthesize(eq(profile), eq(research), eq("Lisbon"), any(), eq(2)))
                .thenReturn(plan(2));

        Map<String, Object> context = new HashMap<>();
        context.put("startDate", "2026-11-10");
        context.put("days", 2);
        AgentResponseVO response = orchestrator.run("plan 2 days in Lisbon", context);

        assertEquals(TravelPlanOrchestrator.STATUS_SUCCESS, response.getStatus());
        assertEquals(TravelPlanOrchestrator.AGENT_NAME, response.getAgent());
        assertEquals(Boolean.FALSE, response.getData().get("degraded"));
        TripPlanVO plan = (TripPlanVO) response.getData().get("plan");
        assertEquals("2026-11-10", plan.getDays().get(0).getDate());
        assertEquals("2026-11-11", plan.getDays().get(1).getDate());

        assertEquals("generating", response.getMediaHandle().getStatus());
        String taskId = response.getMediaHandle().getTaskId();
        assertDoesNotThrow(() -> UUID.fromString(taskId));
        ArgumentCaptor<MediaTaskPayload> payload = ArgumentCaptor.forClass(MediaTaskPayload.class);
        verify(mediaTaskService).enqueue(eq(taskId), payload.capture());
        assertEquals("Lisbon", payload.getValue().getDestination());
        assertEquals(List.of("Day 1 theme", "Day 2 theme"), payload.getValue().getDayThemes());

        ArgumentCaptor<ResearchQuery> query = ArgumentCaptor.forClass(ResearchQuery.class);
        verify(researchFanOut).research(query.capture());
        assertEquals("Lisbon", query.getValue().getQuery());
        assertEquals(LocalDate.of(2026, 11, 10), query.getValue().getStartDate());
        verify(metricsRecorder).recordOrchestration("success");
    }

    @Test
    void run_shouldUseRawMessageAsQuery_andDefaultDates_whenProfileHasNoDestination() {
        TravelerProfileDTO profile = TravelerProfileDTO.defaults();
        stubProfile("plan a beach vacation", profile);
        when(researchFanOut.research(any())).thenReturn(ResearchContext.empty());
        when(itinerarySynthesizer.synthesize(any(), any(), anyString(), any(), anyInt())).thenReturn(plan(3));

        orchestrator.run("plan a beach vacation", null);

        ArgumentCaptor<ResearchQuery> query = ArgumentCaptor.forClass(ResearchQuery.class);
        verify(researchFanOut).research(query.capture());
        assertEquals("plan a beach vacation", query.getValue().getQuery());
        assertEquals(LocalDate.of(2026, 10, 20), query.getValue().getStartDate());
        assertEquals(3, query.getValue().getDays());
    }

    @Test
    void run_shouldDegradeToLocalPlan_whenSynthesisFails() {
        TravelerProfileDTO profile = profileFor("Kyoto");
        stubProfile("trip to Kyoto", profile);
        when(researchFanOut.research(any())).thenReturn(ResearchContext.empty());
        when(itinerarySynthesizer.synthesize(any(), any(), anyString(), any(), anyInt()))
                .thenThrow(new IllegalStateException("reasoning down"));
        when(itinerarySynthesizer.buildLocalPlan(eq(profile), any(), eq("Kyoto"), eq(3))).thenReturn(plan(3));

        AgentResponseVO response = orchestrator.run("trip to Kyoto", new HashMap<>());

        assertEquals(TravelPlanOrchestrator.STATUS_SUCCESS, response.getStatus());
        assertEquals(Boolean.TRUE, response.getData().get("degraded"));
        verify(metricsRecorder).recordOrchestration("degraded");
    }

    @Test
    void run_shouldUseTomorrow_whenStartDateTooFarInFuture() {
        TravelerProfileDTO profile = profileFor("Lisbon");
        stubProfile("plan Lisbon", profile);
        when(researchFanOut.research(any())).thenReturn(ResearchContext.empty());
        when(itinerarySynthesizer.synthesize(eq(profile), any(), eq("Lisbon"), eq(LocalDate.of(2026, 10, 20)), eq(2)))
                .thenReturn(plan(2));

        Map<String, Object> context = new HashMap<>();
        context.put("startDate", "+999999999-12-31");
        context.put("days", 2);
        AgentResponseVO response = orchestrator.run("plan Lisbon", context);

        assertEquals(TravelPlanOrchestrator.STATUS_SUCCESS, response.getStatus());
        TripPlanVO plan = (TripPlanVO) response.getData().get("plan");
        assertEquals("2026-10-20", plan.getDays().get(0).getDate());
        assertEquals("2026-10-21", plan.getDays().get(1).getDate());
    }

    @Test
    void run_shouldCapRequestedDays_beforeBuildingLocalPlan() {
        TravelerProfileDTO profile = profileFor("Kyoto");
        stubProfile("trip to Kyoto", profile);
        when(researchFanOut.research(any())).thenReturn(ResearchContext.empty());
        when(itinerarySynthesizer.synthesize(any(), any(), anyString(), any(), anyInt())).thenReturn(null);
        when(itinerarySynthesizer.buildLocalPlan(eq(profile), any(), eq("Kyoto"), eq(30))).thenReturn(plan(30));

        Map<String, Object> context = new HashMap<>();
        context.put("days", 500000);
        AgentResponseVO response = orchestrator.run("trip to Kyoto", context);

        assertEquals(30, response.getData().get("days"));
        TripPlanVO plan = (TripPlanVO) response.getData().get("plan");
        assertEquals(30, plan.getDays().size());
        assertEquals("2026-11-18", plan.getDays().get(29).getDate());
    }

    @Test
    void run_shouldReturnEmptyPlan_whenLocalPlanAlsoFails() {
        TravelerProfileDTO profile = profileFor("Kyoto");
        stubProfile("trip to Kyoto", profile);
        when(researchFanOut.research(any())).thenReturn(ResearchContext.empty());
        when(itinerarySynthesizer.synthesize(any(), any(), anyString(), any(), anyInt()))
                .thenThrow(new IllegalStateException("reasoning down"));
        when(itinerarySynthesizer.buildLocalPlan(any(), any(), anyString(), anyInt()))
                .thenThrow(new IllegalStateException("template broken"));

        AgentResponseVO response = orchestrator.run("trip to Kyoto", new HashMap<>());

        assertEquals(TravelPlanOrchestrator.STATUS_SUCCESS, response.getStatus());
        assertEquals(Boolean.TRUE, response.getData().get("degraded"));
        TripPlanVO plan = (TripPlanVO) response.getData().get("plan");
        assertEquals("Trip to Kyoto", plan.getTitle());
        assertEquals("generating", response.getMediaHandle().getStatus());
    }

    @Test
    void run_shouldContinueWithEmptyResearch_whenFanOutThrows() {
        TravelerProfileDTO profile = profileFor("Cairo");
        stubProfile("visit Cairo", profile);
        when(researchFanOut.research(any())).thenThrow(new IllegalStateException("pool closed"));
        when(itinerarySynthesizer.synthesize(any(), any(), anyString(), any(), anyInt())).thenReturn(plan(1));

        AgentResponseVO response = orchestrator.run("visit Cairo", new HashMap<>());

        ArgumentCaptor<ResearchContext> research = ArgumentCaptor.forClass(ResearchContext.class);
        verify(itinerarySynthesizer).synthesize(any(), research.capture(), anyString(), any(), anyInt());
        assertEquals(0, research.getValue().totalItems());
        assertEquals(TravelPlanOrchestrator.STATUS_SUCCESS, response.getStatus());
    }

    @Test
    void run_shouldReturnPlanWithFailedHandle_whenEnqueueFails() {
        TravelerProfileDTO profile = profileFor("Oslo");
        stubProfile("plan Oslo", profile);
        when(researchFanOut.research(any())).thenReturn(ResearchContext.empty());
        when(itinerarySynthesizer.synthesize(any(), any(), anyString(), any(), anyInt())).thenReturn(plan(2));
        doThrow(new IllegalStateException("redis down")).when(mediaTaskService).enqueue(anyString(), any());

        AgentResponseVO response = orchestrator.run("plan Oslo", new HashMap<>());

        assertEquals(TravelPlanOrchestrator.STATUS_SUCCESS, response.getStatus());
        assertNotNull(response.getData().get("plan"));
        assertEquals("failed", response.getMediaHandle().getStatus());
        assertNull(response.getMediaHandle().getTaskId());
    }

    @Test
    void run_shouldRememberPlan_onlyForLoggedInUser() {
        TravelerProfileDTO profile = profileFor("Oslo");
        stubProfile("plan Oslo", profile);
        when(researchFanOut.research(any())).thenReturn(ResearchContext.empty());
        TripPlanVO plan = plan(2);
        when(itinerarySynthesizer.synthesize(any(), any(), anyString(), any(), anyInt())).thenReturn(plan);

        orchestrator.run("plan Oslo", new HashMap<>());
        verify(itineraryService, never()).rememberPlan(any(), any());

        BaseContext.setCurrentId(42L);
        orchestrator.run("plan Oslo", new HashMap<>());
        verify(itineraryService).rememberPlan(42L, plan);
    }

    @Test
    void run_shouldPropagateProfileException_withoutResearch() {
        when(travelerProfileService.restore("broken")).thenThrow(new ProfileException("bad snapshot", null));
        Map<String, Object> context = new HashMap<>();
        context.put("profile", "broken");

        assertThrows(ProfileException.class, () -> orchestrator.run("plan a trip", context));
        verifyNoInteractions(researchFanOut, itinerarySynthesizer, mediaTaskService);
    }

    @Test
    void run_shouldWrapUnexpectedProfilingFailure_asProfileException() {
        when(travelerProfileService.restore(null)).thenReturn(TravelerProfileDTO.defaults());
        when(travelerProfileService.apply(anyString(), any())).thenThrow(new IllegalStateException("boom"));

        assertThrows(ProfileException.class, () -> orchestrator.run("plan a trip", new HashMap<>()));
    }

    private void stubProfile(String message, TravelerProfileDTO profile) {
        when(travelerProfileService.restore(null)).thenReturn(profile);
        when(travelerProfileService.apply(message, profile)).thenReturn(new ProfileResult(profile,
                Collections.emptyList(), Collections.emptyList(), ProfileResult.STATUS_PROFILE_UPDATED));
    }

    private static TravelerProfileDTO profileFor(String destination) {
        TravelerProfileDTO profile = TravelerProfileDTO.defaults();
        profile.setDestination(destination);
        return profile;
    }

    private static TripPlanVO plan(int days) {
        TripPlanVO plan = new TripPlanVO();
        plan.setTitle("Test plan");
        plan.setSummary("A test plan");
        List<DayPlanVO> dayPlans = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            DayPlanVO day = new DayPlanVO();
            day.setTheme("Day " + (i + 1) + " theme");
            dayPlans.add(day);
        }
        plan.setDays(dayPlans);
        return plan;
    }
}
