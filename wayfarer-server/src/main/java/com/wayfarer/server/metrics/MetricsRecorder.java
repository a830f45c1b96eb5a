package com.wayfarer.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 基于 Micrometer 的 MeterRegistry 记录 Counter / Timer；
 * - 指标记录失败只打 debug 日志，绝不影响业务流程；
 * - 指标命名遵循「wayfarer.模块.动作」，Tag 值统一经过 safe() 截断，避免高基数。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录用户最近方案缓存的命中/未命中情况。
     *
     * @param hit true 表示命中缓存，false 表示回源数据库
     */
    public void recordPlanCacheHit(boolean hit) {
        try {
            String outcome = hit ? "hit" : "miss";
            meterRegistry.counter("wayfarer.plan.cache", "outcome", outcome).increment();
        } catch (Exception e) {
            log.debug("记录缓存命中指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录 AI Chat 调用结果（成功/失败/跳过）。
     */
    public void recordAiChatCall(String outcome, String reason, String model) {
        try {
            meterRegistry.counter("wayfarer.ai.chat.call",
                    "outcome", safe(outcome),
                    "reason", safe(reason),
                    "model", safe(model)).increment();
        } catch (Exception e) {
            log.debug("记录 AI 调用指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录 AI Chat 调用耗时。
     */
    public void recordAiChatLatencyMs(long latencyMs, String outcome, String model) {
        try {
            meterRegistry.timer("wayfarer.ai.chat.latency",
                    "outcome", safe(outcome),
                    "model", safe(model))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录 AI 耗时指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录单个调研源的执行结果与耗时。
     *
     * @param provider 调研源名称
     * @param outcome  success / empty / error / timeout
     */
    public void recordResearchProvider(String provider, String outcome, long latencyMs) {
        try {
            meterRegistry.counter("wayfarer.research.provider",
                    "provider", safe(provider),
                    "outcome", safe(outcome)).increment();
            meterRegistry.timer("wayfarer.research.provider.latency", "provider", safe(provider))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录调研指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录趋势发现循环的结束状态与实际尝试次数。
     */
    public void recordTrendDiscovery(String status, int attemptsUsed) {
        try {
            meterRegistry.counter("wayfarer.trend.discovery",
                    "status", safe(status),
                    "attempts", String.valueOf(attemptsUsed)).increment();
        } catch (Exception e) {
            log.debug("记录趋势发现指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录编排请求在哪个阶段结束（early_return / responded / degraded）。
     */
    public void recordOrchestration(String outcome) {
        try {
            meterRegistry.counter("wayfarer.orchestrator.run", "outcome", safe(outcome)).increment();
        } catch (Exception e) {
            log.debug("记录编排指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录媒体后台任务的状态变更。
     *
     * @param executor local / rabbit
     * @param status   目标状态
     */
    public void recordMediaTask(String executor, String status) {
        try {
            meterRegistry.counter("wayfarer.media.task",
                    "executor", safe(executor),
                    "status", safe(status)).increment();
        } catch (Exception e) {
            log.debug("记录媒体任务指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        // tag 不宜过长，避免高基数/卡面板
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
