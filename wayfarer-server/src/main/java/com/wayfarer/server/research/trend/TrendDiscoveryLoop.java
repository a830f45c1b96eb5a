package com.wayfarer.server.research.trend;

import com.wayfarer.server.metrics.MetricsRecorder;
import com.wayfarer.server.research.ProviderResult;
import com.wayfarer.server.research.gateway.SocialTrendGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 趋势发现的放宽重试循环。
 *
 * 状态机：ATTEMPTING -> {SUCCESS | BROADENING -> ATTEMPTING(query', n+1) | EXHAUSTED}
 * - 每轮分别调用话题标签与旅行内容两个数据源，异常按空结果处理；
 * - 两者都为空，或有数据但提炼出的趋势为空，视为本轮无结果；
 * - 无结果且未到最后一轮时放宽查询词再试；最后一轮不再放宽，直接结束；
 * - 循环本身从不抛异常，耗尽后返回初始查询词 + 空结果 + partial_success。
 *
 * 每轮都会用新的查询词重新拉取原始数据，总外部调用次数上限为
 * 3 轮 x 2 个数据源 + 3 次提炼 + 2 次放宽。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrendDiscoveryLoop {

    public static final int MAX_ATTEMPTS = 3;

    private final SocialTrendGateway socialTrendGateway;
    private final QueryBroadener queryBroadener;
    private final TrendSynthesizer trendSynthesizer;
    private final MetricsRecorder metricsRecorder;

    public TrendDiscoveryResult discover(String initialQuery) {
        return discover(initialQuery, MAX_ATTEMPTS);
    }

    public TrendDiscoveryResult discover(String initialQuery, int maxAttempts) {
        int attemptsAllowed = Math.max(1, maxAttempts);
        String query = initialQuery;
        int attempt = 1;
        List<Map<String, Object>> trends = Collections.emptyList();
        LoopState state = LoopState.ATTEMPTING;

        while (state != LoopState.SUCCESS && state != LoopState.EXHAUSTED) {
            switch (state) {
                case ATTEMPTING -> {
                    trends = attemptOnce(query, attempt);
                    if (!trends.isEmpty()) {
                        state = LoopState.SUCCESS;
                    } else if (attempt >= attemptsAllowed) {
                        state = LoopState.EXHAUSTED;
                    } else {
                        state = LoopState.BROADENING;
                    }
                }
                case BROADENING -> {
                    String broader = safeBroaden(query);
                    log.info("趋势调研无结果，放宽查询词: attempt={}, from={}, to={}", attempt, query, broader);
                    query = broader;
                    attempt++;
                    state = LoopState.ATTEMPTING;
                }
                default -> state = LoopState.EXHAUSTED;
            }
        }

        if (state == LoopState.SUCCESS) {
            metricsRecorder.recordTrendDiscovery(ProviderResult.STATUS_SUCCESS, attempt);
            return new TrendDiscoveryResult(query, trends, attempt, ProviderResult.STATUS_SUCCESS, query);
        }
        log.warn("趋势调研耗尽重试次数: initialQuery={}, lastQuery={}, attempts={}", initialQuery, query, attempt);
        metricsRecorder.recordTrendDiscovery(ProviderResult.STATUS_PARTIAL_SUCCESS, attempt);
        return new TrendDiscoveryResult(initialQuery, Collections.emptyList(), attempt,
                ProviderResult.STATUS_PARTIAL_SUCCESS, query);
    }

    private List<Map<String, Object>> attemptOnce(String query, int attempt) {
        List<Map<String, Object>> hashtags = safeFetch("hashtags", query, socialTrendGateway::trendingHashtags);
        List<Map<String, Object>> content = safeFetch("content", query, socialTrendGateway::searchTravelContent);
        if (hashtags.isEmpty() && content.isEmpty()) {
            log.debug("趋势数据源均为空: query={}, attempt={}", query, attempt);
            return Collections.emptyList();
        }
        try {
            List<Map<String, Object>> trends = trendSynthesizer.synthesize(query, hashtags, content);
            return trends == null ? Collections.emptyList() : trends;
        } catch (Exception e) {
            log.warn("趋势提炼异常，按空结果处理: query={}, attempt={}, err={}", query, attempt, e.getMessage());
            return Collections.emptyList();
        }
    }

    private List<Map<String, Object>> safeFetch(String source, String query,
                                                Function<String, List<Map<String, Object>>> fetcher) {
        try {
            List<Map<String, Object>> items = fetcher.apply(query);
            return items == null ? Collections.emptyList() : items;
        } catch (Exception e) {
            log.warn("趋势数据源异常，按空结果处理: source={}, query={}, err={}", source, query, e.getMessage());
            return Collections.emptyList();
        }
    }

    private String safeBroaden(String query) {
        try {
            String broader = queryBroadener.broaden(query);
            return StringUtils.hasText(broader) ? broader.trim() : query;
        } catch (Exception e) {
            log.warn("放宽查询词异常，沿用原查询词: query={}, err={}", query, e.getMessage());
            return query;
        }
    }

    private enum LoopState {
        ATTEMPTING,
        BROADENING,
        SUCCESS,
        EXHAUSTED
    }
}
