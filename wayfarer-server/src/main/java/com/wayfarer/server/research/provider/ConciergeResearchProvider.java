package com.wayfarer.server.research.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.wayfarer.pojo.dto.TravelerProfileDTO;
import com.wayfarer.server.research.ProviderResult;
import com.wayfarer.server.research.ResearchProvider;
import com.wayfarer.server.research.ResearchQuery;
import com.wayfarer.server.research.gateway.HotelSearchArgs;
import com.wayfarer.server.research.gateway.HotelSearchGateway;
import com.wayfarer.server.research.gateway.PlaceSearchArgs;
import com.wayfarer.server.research.gateway.PlacesGateway;
import com.wayfarer.server.utils.AiClient;
import com.wayfarer.server.utils.LlmJsonParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 礼宾调研：由推理服务决定查酒店还是查地点 / 餐饮，再调用对应检索接口。
 *
 * 推理输出 {"tool": "...", "arguments": {...}} 先解码为 {@link ConciergeCommand}，
 * 参数缺失的字段用画像与行程日期补齐；推理失败或工具名未知时走 FALLBACK。
 */
@Component
@Order(3)
@RequiredArgsConstructor
@Slf4j
public class ConciergeResearchProvider implements ResearchProvider {

    public static final String NAME = "concierge";

    private static final String SYSTEM_PROMPT = "You are a travel concierge. Pick exactly ONE tool for the traveler "
            + "and return ONLY JSON: {\"tool\": \"search_hotels\" | \"search_places\", \"arguments\": {...}}. "
            + "search_hotels arguments: {\"location\", \"check_in\", \"check_out\", \"guests\", \"price_levels\", \"amenities\"}. "
            + "search_places arguments: {\"query\", \"location\", \"price_levels\", \"min_rating\"}. "
            + "Respect dietary, religious and accessibility needs from the profile in CONTEXT.";

    private static final Map<String, List<Integer>> PRICE_LEVELS = Map.of(
            "budget", List.of(0, 1),
            "moderate", List.of(1, 2),
            "luxury", List.of(2, 3, 4));

    private final AiClient aiClient;
    private final LlmJsonParser llmJsonParser;
    private final HotelSearchGateway hotelSearchGateway;
    private final PlacesGateway placesGateway;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderResult research(ResearchQuery query) {
        ConciergeCommand command = decide(query);
        List<Map<String, Object>> items = switch (command.getTool()) {
            case SEARCH_HOTELS -> hotelSearchGateway.searchHotels(completeHotelArgs(command.getHotelArgs(), query));
            case SEARCH_PLACES, FALLBACK -> placesGateway.searchPlaces(completePlaceArgs(command.getPlaceArgs(), query));
        };
        if (command.getTool() == ConciergeTool.FALLBACK) {
            log.info("礼宾调研走兜底检索: query={}, reason={}", query.getQuery(), command.getFallbackReason());
        }
        ProviderResult result = ProviderResult.success(items);
        result.getAttributes().put("tool", command.getTool().getCode());
        return result;
    }

    /**
     * 请推理服务选择工具，并把输出解码为封闭的命令类型。
     */
    ConciergeCommand decide(ResearchQuery query) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("destination", query.getQuery());
        context.put("profile", query.getProfile());
        context.put("startDate", query.getStartDate() == null ? null : query.getStartDate().toString());
        context.put("days", query.getDays());

        JsonNode root = llmJsonParser.parseObject(aiClient.chat(SYSTEM_PROMPT, "Traveler request: " + query.getMessage(), context));
        return decode(root);
    }

    ConciergeCommand decode(JsonNode root) {
        if (root == null) {
            return ConciergeCommand.fallback("reasoning_unavailable");
        }
        String toolName = root.path("tool").asText(null);
        ConciergeTool tool = ConciergeTool.fromCode(toolName);
        JsonNode arguments = root.path("arguments");
        return switch (tool) {
            case SEARCH_HOTELS -> ConciergeCommand.hotels(llmJsonParser.convert(arguments, HotelSearchArgs.class));
            case SEARCH_PLACES -> ConciergeCommand.places(llmJsonParser.convert(arguments, PlaceSearchArgs.class));
            case FALLBACK -> ConciergeCommand.fallback("unknown_tool:" + toolName);
        };
    }

    private HotelSearchArgs completeHotelArgs(HotelSearchArgs args, ResearchQuery query) {
        TravelerProfileDTO profile = query.getProfile();
        if (!StringUtils.hasText(args.getLocation())) {
            args.setLocation(query.getQuery());
        }
        if (args.getGuests() == null && profile != null) {
            args.setGuests(profile.getGroupSize());
        }
        if (!StringUtils.hasText(args.getCheckIn()) && query.getStartDate() != null) {
            args.setCheckIn(query.getStartDate().toString());
            args.setCheckOut(query.getStartDate().plusDays(Math.max(1, query.getDays())).toString());
        }
        if (args.getPriceLevels() == null || args.getPriceLevels().isEmpty()) {
            args.setPriceLevels(priceLevels(profile));
        }
        if ((args.getAmenities() == null || args.getAmenities().isEmpty())
                && profile != null && profile.getAccessibilityNeeds() != null) {
            args.setAmenities(new ArrayList<>(profile.getAccessibilityNeeds()));
        }
        return args;
    }

    private PlaceSearchArgs completePlaceArgs(PlaceSearchArgs args, ResearchQuery query) {
        if (!StringUtils.hasText(args.getLocation())) {
            args.setLocation(query.getQuery());
        }
        if (!StringUtils.hasText(args.getQuery())) {
            args.setQuery(defaultPlaceQuery(query.getProfile(), args.getLocation()));
        }
        if (args.getPriceLevels() == null || args.getPriceLevels().isEmpty()) {
            args.setPriceLevels(priceLevels(query.getProfile()));
        }
        return args;
    }

    /**
     * 饮食 / 宗教限制优先，其次是兴趣，最后退化为热门景点。
     */
    static String defaultPlaceQuery(TravelerProfileDTO profile, String location) {
        String where = StringUtils.hasText(location) ? " in " + location : "";
        if (profile != null) {
            String dietary = first(profile.getDietaryRestrictions());
            if (dietary == null) {
                dietary = first(profile.getReligiousRequirements());
            }
            if (dietary != null) {
                return dietary + " restaurants" + where;
            }
            String interest = first(profile.getInterests());
            if (interest != null) {
                return interest + where;
            }
        }
        return "top attractions" + where;
    }

    static List<Integer> priceLevels(TravelerProfileDTO profile) {
        String budget = profile == null || profile.getBudgetLevel() == null
                ? TravelerProfileDTO.DEFAULT_BUDGET_LEVEL
                : profile.getBudgetLevel().toLowerCase(Locale.ROOT);
        return PRICE_LEVELS.getOrDefault(budget, PRICE_LEVELS.get(TravelerProfileDTO.DEFAULT_BUDGET_LEVEL));
    }

    private static String first(List<String> values) {
        if (values == null) {
            return null;
        }
        for (String v : values) {
            if (StringUtils.hasText(v)) {
                return v.trim();
            }
        }
        return null;
    }
}
