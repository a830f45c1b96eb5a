package com.wayfarer.server.ai;

import com.wayfarer.pojo.dto.TravelerProfileDTO;
import com.wayfarer.pojo.vo.DayPlanVO;
import com.wayfarer.pojo.vo.TimeSlotVO;
import com.wayfarer.pojo.vo.TripPlanVO;
import com.wayfarer.server.research.ResearchContext;
import com.wayfarer.server.research.provider.ConciergeResearchProvider;
import com.wayfarer.server.research.provider.DestinationResearchProvider;
import com.wayfarer.server.research.provider.TrendResearchProvider;
import com.wayfarer.server.utils.AiClient;
import com.wayfarer.server.utils.LlmJsonParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 行程合成：把画像 + 合并后的调研结果交给推理服务，产出结构化行程。
 * 推理失败或输出不可用时返回 null，由编排器决定是否降级为本地行程。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ItinerarySynthesizer {

    private static final String SYSTEM_PROMPT = "You are a travel itinerary optimizer. "
            + "Using the traveler profile and research results in CONTEXT, build a day-by-day itinerary. "
            + "Return ONLY JSON: {\"title\": \"\", \"summary\": \"\", \"days\": [{\"day_number\": 1, \"theme\": \"\", "
            + "\"time_slots\": [{\"start_time\": \"09:00\", \"end_time\": \"11:00\", \"activity_type\": \"\", "
            + "\"activity\": \"\", \"location\": \"\", \"notes\": \"\"}], \"total_travel_time\": \"\", "
            + "\"estimated_cost\": \"\"}], \"transport\": {}, \"accommodation\": {}, \"tips\": []}. "
            + "Respect dietary, religious, allergy and accessibility constraints strictly.";

    private final AiClient aiClient;
    private final LlmJsonParser llmJsonParser;

    public TripPlanVO synthesize(TravelerProfileDTO profile,
                                 ResearchContext research,
                                 String destination,
                                 LocalDate startDate,
                                 int days) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("profile", profile);
        context.put("destination", destination);
        context.put("startDate", startDate == null ? null : startDate.toString());
        context.put("days", days);
        context.put("destinations", research.items(DestinationResearchProvider.NAME));
        context.put("trends", research.items(TrendResearchProvider.NAME));
        context.put("accommodations", research.items(ConciergeResearchProvider.NAME));

        String userPrompt = "Plan a " + days + "-day trip to " + destination + ".";
        TripPlanVO plan = llmJsonParser.parse(aiClient.chat(SYSTEM_PROMPT, userPrompt, context), TripPlanVO.class);
        if (plan == null || plan.getDays() == null || plan.getDays().isEmpty()) {
            log.warn("行程合成结果为空: destination={}, days={}", destination, days);
            return null;
        }
        if (!StringUtils.hasText(plan.getTitle())) {
            plan.setTitle(days + "-day trip to " + destination);
        }
        return plan;
    }

    /**
     * 本地兜底行程：推理不可用时也给调用方一个结构完整、可编辑的骨架。
     */
    public TripPlanVO buildLocalPlan(TravelerProfileDTO profile, ResearchContext research, String destination, int days) {
        TripPlanVO plan = new TripPlanVO();
        plan.setTitle(days + "-day trip to " + destination);

        StringBuilder summary = new StringBuilder();
        summary.append("A ").append(days).append("-day itinerary for ").append(destination);
        if (profile != null && profile.getInterests() != null && !profile.getInterests().isEmpty()) {
            summary.append(" focused on ").append(String.join(", ", profile.getInterests()));
        }
        if (profile != null && StringUtils.hasText(profile.getBudgetLevel())) {
            summary.append(", at a ").append(profile.getBudgetLevel()).append(" budget");
        }
        summary.append(". Details could not be generated automatically; adjust each day as needed.");
        plan.setSummary(summary.toString());

        List<String> highlights = new ArrayList<>();
        collectTitles(highlights, research.items(TrendResearchProvider.NAME));
        collectTitles(highlights, research.items(DestinationResearchProvider.NAME));
        collectTitles(highlights, research.items(ConciergeResearchProvider.NAME));

        List<DayPlanVO> dayPlans = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            DayPlanVO day = new DayPlanVO();
            day.setDayNumber(i + 1);
            String highlight = i < highlights.size() ? highlights.get(i) : null;
            day.setTheme(highlight != null ? highlight : "Explore " + destination);

            TimeSlotVO morning = new TimeSlotVO();
            morning.setStartTime("09:00");
            morning.setEndTime("12:00");
            morning.setActivityType("sightseeing");
            morning.setActivity(highlight != null ? highlight : "Free exploration");
            morning.setLocation(destination);

            TimeSlotVO afternoon = new TimeSlotVO();
            afternoon.setStartTime("14:00");
            afternoon.setEndTime("18:00");
            afternoon.setActivityType("leisure");
            afternoon.setActivity("Local neighborhoods and food");
            afternoon.setLocation(destination);

            day.setTimeSlots(new ArrayList<>(List.of(morning, afternoon)));
            dayPlans.add(day);
        }
        plan.setDays(dayPlans);
        return plan;
    }

    private void collectTitles(List<String> target, List<Map<String, Object>> items) {
        for (Map<String, Object> item : items) {
            Object title = item.get("title");
            if (title == null) {
                title = item.get("name");
            }
            if (title != null && StringUtils.hasText(String.valueOf(title))) {
                target.add(String.valueOf(title));
            }
        }
    }
}
