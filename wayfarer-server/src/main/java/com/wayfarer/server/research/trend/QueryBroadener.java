package com.wayfarer.server.research.trend;

import com.wayfarer.server.utils.AiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 请推理服务把查询词放宽一级，例如街区 -> 所在城市、城市 -> 所在地区。
 * 推理失败时原样返回当前查询词。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryBroadener {

    private static final String SYSTEM_PROMPT = "You help a travel trend search that returned no results. "
            + "Given a location, reply with ONE broader location that contains it "
            + "(e.g. a neighborhood -> its city, a city -> its region or country). "
            + "Reply with the location name only, no punctuation or explanation.";

    private static final int MAX_QUERY_CHARS = 80;

    private final AiClient aiClient;

    public String broaden(String query) {
        String reply = aiClient.chat(SYSTEM_PROMPT, "Location: " + query);
        if (!StringUtils.hasText(reply)) {
            log.warn("查询词放宽失败，沿用原查询词: query={}", query);
            return query;
        }
        String broader = reply.trim().split("\\R", 2)[0];
        broader = broader.replaceAll("^[\"'`]+|[\"'`.。]+$", "").trim();
        if (!StringUtils.hasText(broader) || broader.length() > MAX_QUERY_CHARS) {
            return query;
        }
        return broader;
    }
}
