package com.wayfarer.server.ai;

import com.wayfarer.pojo.dto.TravelerProfileDTO;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * 门控：判断本轮对话是否值得进入调研与合成。
 * 输入包含行程规划意图词，或画像已有明确目的地时放行。
 */
public final class IntentGate {

    static final List<String> INTENT_SIGNALS = List.of(
            "plan", "itinerary", "go to", "trip", "book", "schedule",
            "travel to", "visit", "vacation", "holiday");

    private IntentGate() {
    }

    public static boolean shouldResearch(String message, TravelerProfileDTO profile) {
        if (profile != null && StringUtils.hasText(profile.getDestination())) {
            return true;
        }
        return hasPlanningIntent(message);
    }

    static boolean hasPlanningIntent(String message) {
        if (!StringUtils.hasText(message)) {
            return false;
        }
        String text = message.toLowerCase(Locale.ROOT);
        for (String signal : INTENT_SIGNALS) {
            if (text.contains(signal)) {
                return true;
            }
        }
        return false;
    }
}
