package com.wayfarer.server.config;

import com.wayfarer.server.research.gateway.DestinationGraphGateway;
import com.wayfarer.server.research.gateway.HotelSearchGateway;
import com.wayfarer.server.research.gateway.PlacesGateway;
import com.wayfarer.server.research.gateway.SocialTrendGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 外部调研数据源的默认实现：未接入真实数据源时返回空列表并打印告警，
 * 保证编排流程在本地 / 测试环境也能完整跑通。
 * 接入真实实现时只需注册同类型 Bean，这里的默认实现会自动让位。
 */
@Configuration
@Slf4j
public class ResearchGatewayConfig {

    @Bean
    @ConditionalOnMissingBean
    public DestinationGraphGateway destinationGraphGateway() {
        return (query, interests, limit) -> disabled("destination-graph", query);
    }

    @Bean
    @ConditionalOnMissingBean
    public PlacesGateway placesGateway() {
        return args -> disabled("places", args.getQuery());
    }

    @Bean
    @ConditionalOnMissingBean
    public HotelSearchGateway hotelSearchGateway() {
        return args -> disabled("hotels", args.getLocation());
    }

    @Bean
    @ConditionalOnMissingBean
    public SocialTrendGateway socialTrendGateway() {
        return new SocialTrendGateway() {
            @Override
            public List<Map<String, Object>> trendingHashtags(String location) {
                return disabled("social-hashtags", location);
            }

            @Override
            public List<Map<String, Object>> searchTravelContent(String location) {
                return disabled("social-content", location);
            }
        };
    }

    private static List<Map<String, Object>> disabled(String gateway, String query) {
        log.warn("调研数据源未配置，返回空结果: gateway={}, query={}", gateway, query);
        return Collections.emptyList();
    }
}
