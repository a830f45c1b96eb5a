package com.wayfarer.server.research;

import com.wayfarer.common.properties.PlannerProperties;
import com.wayfarer.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 并行调研：扇出到全部调研源，等待全部结束后合并为 {@link ResearchContext}。
 *
 * - 每个调研源单独包一层，异常 / 超时 / 返回 null 一律转成空结果，互不影响；
 * - 扇入等待全部完成，不会因为某一个失败而提前取消其他调研源；
 * - 调研源之间没有顺序保证。
 */
@Component
@Slf4j
public class ResearchFanOut {

    private final List<ResearchProvider> providers;
    private final Executor researchExecutor;
    private final PlannerProperties plannerProperties;
    private final MetricsRecorder metricsRecorder;

    public ResearchFanOut(List<ResearchProvider> providers,
                          @Qualifier("researchExecutor") Executor researchExecutor,
                          PlannerProperties plannerProperties,
                          MetricsRecorder metricsRecorder) {
        this.providers = providers;
        this.researchExecutor = researchExecutor;
        this.plannerProperties = plannerProperties;
        this.metricsRecorder = metricsRecorder;
    }

    public ResearchContext research(ResearchQuery query) {
        long start = System.currentTimeMillis();
        List<String> names = new ArrayList<>(providers.size());
        List<CompletableFuture<ProviderResult>> futures = new ArrayList<>(providers.size());
        for (ResearchProvider provider : providers) {
            names.add(provider.name());
            futures.add(launch(provider, query));
        }

        // 每个 future 自带兜底，这里的 join 不会抛出
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<String, ProviderResult> results = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            results.put(names.get(i), futures.get(i).join());
        }
        ResearchContext context = new ResearchContext(results);
        log.info("并行调研完成: query={}, providers={}, totalItems={}, costMs={}",
                query.getQuery(), names, context.totalItems(), System.currentTimeMillis() - start);
        return context;
    }

    private CompletableFuture<ProviderResult> launch(ResearchProvider provider, ResearchQuery query) {
        String name = provider.name();
        long start = System.currentTimeMillis();
        CompletableFuture<ProviderResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> provider.research(query), researchExecutor);
        } catch (Exception e) {
            // 线程池已关闭等极端情况
            log.warn("调研任务提交失败: provider={}, err={}", name, e.getMessage());
            metricsRecorder.recordResearchProvider(name, "error", 0L);
            return CompletableFuture.completedFuture(ProviderResult.error());
        }
        return future
                .orTimeout(Math.max(1L, plannerProperties.getResearchTimeoutSeconds()), TimeUnit.SECONDS)
                .handle((result, ex) -> {
                    long costMs = System.currentTimeMillis() - start;
                    if (ex != null) {
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        boolean timeout = cause instanceof TimeoutException;
                        log.warn("调研源执行失败，按空结果处理: provider={}, timeout={}, err={}",
                                name, timeout, cause.toString());
                        metricsRecorder.recordResearchProvider(name, timeout ? "timeout" : "error", costMs);
                        return ProviderResult.error();
                    }
                    if (result == null) {
                        metricsRecorder.recordResearchProvider(name, "error", costMs);
                        return ProviderResult.error();
                    }
                    String outcome = result.getItems() == null || result.getItems().isEmpty() ? "empty" : "success";
                    metricsRecorder.recordResearchProvider(name, outcome, costMs);
                    return result;
                });
    }
}
