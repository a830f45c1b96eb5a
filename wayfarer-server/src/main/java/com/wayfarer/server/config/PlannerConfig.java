package com.wayfarer.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 规划相关的基础 Bean。
 */
@Configuration
public class PlannerConfig {

    /**
     * 默认起始日期（明天）依赖当前时间，统一从 Clock 取，测试中可替换为固定时钟。
     */
    @Bean
    public Clock plannerClock() {
        return Clock.systemDefaultZone();
    }
}
