package com.jay.compliance.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the X-API-Key header against security.api_keys when
 * security.require_api_key is set. Every configured key is compared in
 * constant time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-API-Key";

    private final ComplianceConfig config;

    @Override
    public boolean preHandle(HttpServletRequest req, HttpServletResponse res, Object handler) throws IOException {
        if (!config.security().isRequireApiKey()) return true;
        if (isValid(req.getHeader(HEADER))) return true;

        log.warn("Rejected {} {}: missing or invalid API key", req.getMethod(), req.getRequestURI());
        res.setStatus(HttpStatus.UNAUTHORIZED.value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.getWriter().write("{\"error\":\"invalid or missing API key\"}");
        return false;
    }

    public boolean isValid(String presented) {
        if (presented == null || presented.isEmpty()) return false;
        byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (String key : config.security().getApiKeys()) {
            match |= MessageDigest.isEqual(candidate, key.getBytes(StandardCharsets.UTF_8));
        }
        return match;
    }
}
