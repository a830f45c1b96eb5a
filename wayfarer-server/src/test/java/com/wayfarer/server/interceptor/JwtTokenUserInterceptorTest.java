package com.wayfarer.server.interceptor;

import com.wayfarer.common.context.BaseContext;
import com.wayfarer.common.properties.JwtProperties;
import com.wayfarer.common.utils.JwtUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * 游客模式下的 token 处理：无 token 放行、合法 token 写入上下文、非法 token 返回 401。
 */
class JwtTokenUserInterceptorTest {

    private static final String SECRET = "test-secret";

    private JwtTokenUserInterceptor interceptor;
    private HandlerMethod handler;

    @BeforeEach
    void setUp() {
        JwtProperties properties = new JwtProperties();
        properties.setUserSecretKey(SECRET);
        interceptor = new JwtTokenUserInterceptor(properties);
        handler = mock(HandlerMethod.class);
    }

    @AfterEach
    void tearDown() {
        BaseContext.clear();
        MDC.clear();
    }

    @Test
    void preHandle_shouldPassAsGuest_whenNoToken() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertTrue(interceptor.preHandle(new MockHttpServletRequest(), response, handler));
        assertTrue(BaseContext.isGuest());
        assertEquals(200, response.getStatus());
    }

    @Test
    void preHandle_shouldSetUser_whenTokenValid() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("authentication", JwtUtil.issueUserToken(SECRET, 60_000L, 42L));

        assertTrue(interceptor.preHandle(request, new MockHttpServletResponse(), handler));
        assertEquals(42L, BaseContext.getCurrentId());
        assertEquals("42", MDC.get("userId"));
    }

    @Test
    void preHandle_shouldReturn401_whenTokenSignedWithOtherKey() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("authentication", JwtUtil.issueUserToken("another-secret", 60_000L, 42L));
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertFalse(interceptor.preHandle(request, response, handler));
        assertEquals(401, response.getStatus());
        assertTrue(BaseContext.isGuest());
    }

    @Test
    void afterCompletion_shouldClearContext() throws Exception {
        BaseContext.setCurrentId(7L);

        interceptor.afterCompletion(new MockHttpServletRequest(), new MockHttpServletResponse(), handler, null);

        assertNull(BaseContext.getCurrentId());
    }
}
