package com.wayfarer.server.research.provider;

import com.wayfarer.server.research.ProviderResult;
import com.wayfarer.server.research.ResearchProvider;
import com.wayfarer.server.research.ResearchQuery;
import com.wayfarer.server.research.trend.TrendDiscoveryLoop;
import com.wayfarer.server.research.trend.TrendDiscoveryResult;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 趋势调研：内部使用放宽重试循环。
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class TrendResearchProvider implements ResearchProvider {

    public static final String NAME = "trends";

    private final TrendDiscoveryLoop trendDiscoveryLoop;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderResult research(ResearchQuery query) {
        TrendDiscoveryResult discovery = trendDiscoveryLoop.discover(query.getQuery());
        ProviderResult result = ProviderResult.of(discovery.getTrends(), discovery.getStatus());
        result.getAttributes().put("searchedLocation", discovery.getFinalQuery());
        result.getAttributes().put("attemptsUsed", discovery.getAttemptsUsed());
        return result;
    }
}
