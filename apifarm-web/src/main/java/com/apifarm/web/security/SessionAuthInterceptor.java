package com.apifarm.web.security;

import com.apifarm.web.service.SessionStore;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 从 {@code Authorization: Bearer <token>} 中取出会话令牌并校验，
 * 校验通过后把用户 ID 和令牌放入请求属性，供控制器读取。
 * <p>
 * 校验失败抛出的 {@link com.apifarm.common.exception.UnauthorizedException} 由全局异常处理器转为 401。
 */
@Component
@RequiredArgsConstructor
public class SessionAuthInterceptor implements HandlerInterceptor {

    public static final String USER_ID_ATTRIBUTE = "apifarm.userId";
    public static final String TOKEN_ATTRIBUTE = "apifarm.token";

    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionStore sessionStore;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String token = extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        Long userId = sessionStore.verify(token);
        request.setAttribute(USER_ID_ATTRIBUTE, userId);
        request.setAttribute(TOKEN_ATTRIBUTE, token);
        return true;
    }

    static String extractToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
