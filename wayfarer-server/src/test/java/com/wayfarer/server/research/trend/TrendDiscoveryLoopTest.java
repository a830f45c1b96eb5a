package com.wayfarer.server.research.trend;

import com.wayfarer.server.metrics.MetricsRecorder;
import com.wayfarer.server.research.ProviderResult;
import com.wayfarer.server.research.gateway.SocialTrendGateway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 趋势放宽重试循环：
 * - 第二轮命中时恰好放宽一次；
 * - 始终为空时跑满 3 轮、放宽 2 次，返回初始查询词 + partial_success；
 * - 数据源异常按空结果处理，循环本身不抛异常。
 */
@ExtendWith(MockitoExtension.class)
class TrendDiscoveryLoopTest {

    private static final List<Map<String, Object>> HASHTAGS = List.of(Map.of("tag", "#lisbon"));
    private static final List<Map<String, Object>> TRENDS = List.of(Map.of("title", "Tram 28 sunset ride"));

    @Mock
    private SocialTrendGateway socialTrendGateway;

    @Mock
    private QueryBroadener queryBroadener;

    @Mock
    private TrendSynthesizer trendSynthesizer;

    @Mock
    private MetricsRecorder metricsRecorder;

    @InjectMocks
    private TrendDiscoveryLoop loop;

    @Test
    void discover_shouldSucceedOnFirstAttempt_withoutBroadening() {
        when(socialTrendGateway.trendingHashtags("Alfama")).thenReturn(HASHTAGS);
        when(socialTrendGateway.searchTravelContent("Alfama")).thenReturn(Collections.emptyList());
        when(trendSynthesizer.synthesize(eq("Alfama"), anyList(), anyList())).thenReturn(TRENDS);

        TrendDiscoveryResult result = loop.discover("Alfama");

        assertEquals(ProviderResult.STATUS_SUCCESS, result.getStatus());
        assertEquals(1, result.getAttemptsUsed());
        assertEquals("Alfama", result.getFinalQuery());
        assertEquals(TRENDS, result.getTrends());
        verifyNoInteractions(queryBroadener);
    }

    @Test
    void discover_shouldBroadenExactlyOnce_whenSecondAttemptSucceeds() {
        when(socialTrendGateway.trendingHashtags("Alfama")).thenReturn(Collections.emptyList());
        when(socialTrendGateway.searchTravelContent("Alfama")).thenReturn(Collections.emptyList());
        when(queryBroadener.broaden("Alfama")).thenReturn("Lisbon");
        when(socialTrendGateway.trendingHashtags("Lisbon")).thenReturn(HASHTAGS);
        when(socialTrendGateway.searchTravelContent("Lisbon")).thenReturn(Collections.emptyList());
        when(trendSynthesizer.synthesize(eq("Lisbon"), anyList(), anyList())).thenReturn(TRENDS);

        TrendDiscoveryResult result = loop.discover("Alfama");

        assertEquals(ProviderResult.STATUS_SUCCESS, result.getStatus());
        assertEquals(2, result.getAttemptsUsed());
        assertEquals("Lisbon", result.getFinalQuery());
        assertEquals(TRENDS, result.getTrends());
        verify(queryBroadener, times(1)).broaden(anyString());
        // 第一轮原始数据为空，不应调用提炼
        verify(trendSynthesizer, never()).synthesize(eq("Alfama"), anyList(), anyList());
    }

    @Test
    void discover_shouldExhaustThreeAttempts_andReturnInitialQuery_whenAlwaysEmpty() {
        when(socialTrendGateway.trendingHashtags(anyString())).thenReturn(Collections.emptyList());
        when(socialTrendGateway.searchTravelContent(anyString())).thenReturn(Collections.emptyList());
        when(queryBroadener.broaden("Alfama")).thenReturn("Lisbon");
        when(queryBroadener.broaden("Lisbon")).thenReturn("Portugal");

        TrendDiscoveryResult result = loop.discover("Alfama");

        assertEquals(ProviderResult.STATUS_PARTIAL_SUCCESS, result.getStatus());
        assertEquals(3, result.getAttemptsUsed());
        assertEquals("Alfama", result.getFinalQuery());
        assertEquals("Portugal", result.getLastQueryTried());
        assertTrue(result.getTrends().isEmpty());
        verify(queryBroadener, times(2)).broaden(anyString());
        verify(socialTrendGateway, times(3)).trendingHashtags(anyString());
        verify(metricsRecorder).recordTrendDiscovery(ProviderResult.STATUS_PARTIAL_SUCCESS, 3);
    }

    @Test
    void discover_shouldTreatGatewayExceptionsAsEmpty_andNeverThrow() {
        when(socialTrendGateway.trendingHashtags(anyString())).thenThrow(new IllegalStateException("quota"));
        when(socialTrendGateway.searchTravelContent(anyString())).thenThrow(new IllegalStateException("quota"));
        when(queryBroadener.broaden(anyString())).thenThrow(new IllegalStateException("reasoning down"));

        TrendDiscoveryResult result = assertDoesNotThrow(() -> loop.discover("Alfama"));

        assertEquals(ProviderResult.STATUS_PARTIAL_SUCCESS, result.getStatus());
        assertEquals(3, result.getAttemptsUsed());
        assertEquals("Alfama", result.getLastQueryTried());
        verify(queryBroadener, times(2)).broaden(anyString());
    }

    @Test
    void discover_shouldContinue_whenRawDataExistsButSynthesisIsEmpty() {
        when(socialTrendGateway.trendingHashtags(anyString())).thenReturn(HASHTAGS);
        when(socialTrendGateway.searchTravelContent(anyString())).thenReturn(Collections.emptyList());
        when(trendSynthesizer.synthesize(eq("Alfama"), anyList(), anyList())).thenReturn(Collections.emptyList());
        when(queryBroadener.broaden("Alfama")).thenReturn("Lisbon");
        when(trendSynthesizer.synthesize(eq("Lisbon"), anyList(), anyList())).thenReturn(TRENDS);

        TrendDiscoveryResult result = loop.discover("Alfama");

        assertEquals(2, result.getAttemptsUsed());
        assertEquals(ProviderResult.STATUS_SUCCESS, result.getStatus());
    }
}
