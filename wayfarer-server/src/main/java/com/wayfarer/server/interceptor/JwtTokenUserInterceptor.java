package com.wayfarer.server.interceptor;

import com.wayfarer.common.context.BaseContext;
import com.wayfarer.common.properties.JwtProperties;
import com.wayfarer.common.utils.JwtUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * 用户端 JWT 拦截器（游客模式）：
 * - 未携带 token：按游客放行，BaseContext 中没有 userId；
 * - 携带了 token 但校验失败：返回 401，避免把过期登录态静默降级成游客；
 * - 校验通过：写入 BaseContext 与 MDC。
 * 需要登录的接口自行判断 BaseContext.getCurrentId() 是否为空。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtTokenUserInterceptor implements HandlerInterceptor {

    private final JwtProperties jwtProperties;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }

        String token = request.getHeader(jwtProperties.getUserTokenName());
        if (!StringUtils.hasText(token)) {
            return true;
        }

        try {
            Long userId = JwtUtil.parseUserId(jwtProperties.getUserSecretKey(), token);
            if (userId != null) {
                BaseContext.setCurrentId(userId);
                // 将 userId 写入 MDC，便于后续日志统一输出
                MDC.put("userId", String.valueOf(userId));
            }
            return true;
        } catch (Exception e) {
            log.warn("用户 JWT 校验失败: {}", e.getMessage());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        BaseContext.clear();
    }
}
