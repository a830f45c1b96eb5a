package com.wayfarer.server.research.provider;

import com.wayfarer.server.research.ProviderResult;
import com.wayfarer.server.research.ResearchProvider;
import com.wayfarer.server.research.ResearchQuery;
import com.wayfarer.server.research.gateway.DestinationGraphGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * 目的地调研：按目的地与兴趣查询图谱。
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class DestinationResearchProvider implements ResearchProvider {

    public static final String NAME = "destinations";

    private static final int LIMIT = 10;

    private final DestinationGraphGateway destinationGraphGateway;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderResult research(ResearchQuery query) {
        List<String> interests = query.getProfile() == null || query.getProfile().getInterests() == null
                ? Collections.emptyList()
                : query.getProfile().getInterests();
        return ProviderResult.success(destinationGraphGateway.findDestinations(query.getQuery(), interests, LIMIT));
    }
}
