package com.jay.compliance.layer7_ratelimit;

import com.jay.compliance.config.ApiKeyInterceptor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * Applies {@link RateLimiter} per caller: a configured API key when one is sent,
 * the remote address otherwise. Unrecognised keys count against the address so
 * rotating the header does not buy a fresh budget.
 */
@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiter rateLimiter;
    private final ApiKeyInterceptor apiKeys;

    @Override
    public boolean preHandle(HttpServletRequest req, HttpServletResponse res, Object handler) throws IOException {
        if (rateLimiter.tryAcquire(identity(req))) return true;

        res.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        res.setHeader("Retry-After", String.valueOf(rateLimiter.getWindow().toSeconds()));
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.getWriter().write("{\"error\":\"too many requests\"}");
        return false;
    }

    String identity(HttpServletRequest req) {
        String key = req.getHeader(ApiKeyInterceptor.HEADER);
        if (apiKeys.isValid(key)) return "key:" + key;
        return "ip:" + req.getRemoteAddr();
    }
}
