package com.wayfarer.server.filter;

import com.wayfarer.common.context.BaseContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * 请求级别的统一日志过滤器：
 * - 生成或透传 X-Trace-Id，并写入 MDC 与响应头；
 * - 请求结束时输出 traceId、userId、方法、URI、状态码与耗时。
 *
 * 注意：调研线程池与媒体任务线程不继承 MDC，那部分日志自行带上 taskId / provider。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class TraceLoggingFilter extends OncePerRequestFilter {

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    private static final String TRACE_ID_KEY = "traceId";
    private static final String USER_ID_KEY = "userId";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();

        String incomingTraceId = request.getHeader(TRACE_ID_HEADER);
        String traceId = StringUtils.hasText(incomingTraceId) ? incomingTraceId : generateTraceId();
        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            log.info("HTTP 请求开始: method={}, uri={}, remoteIp={}",
                    request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
            filterChain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - start;
            String mdcUserId = MDC.get(USER_ID_KEY);
            Long userId = BaseContext.getCurrentId();
            String finalUserId = StringUtils.hasText(mdcUserId)
                    ? mdcUserId
                    : (userId == null ? "guest" : String.valueOf(userId));

            log.info("HTTP 请求结束: userId={}, method={}, uri={}, status={}, durationMs={}",
                    finalUserId, request.getMethod(), request.getRequestURI(),
                    response.getStatus(), duration);

            // 清理 MDC，避免线程复用导致数据串线
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(USER_ID_KEY);
        }
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
