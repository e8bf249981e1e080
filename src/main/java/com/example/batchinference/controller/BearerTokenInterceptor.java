package com.example.batchinference.controller;

import com.example.batchinference.exception.InvalidTokenException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the inbound {@code Authorization: Bearer} header before the request
 * body is bound, so an unauthenticated caller never sees validation errors.
 * Disabled when no inbound token is configured.
 */
public class BearerTokenInterceptor implements HandlerInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] expected;

    public BearerTokenInterceptor(String inboundToken) {
        this.expected = StringUtils.hasText(inboundToken) ? inboundToken.getBytes(StandardCharsets.UTF_8) : null;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        verify(request.getHeader(HttpHeaders.AUTHORIZATION));
        return true;
    }

    void verify(String authorization) {
        if (expected == null) {
            return;
        }
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw new InvalidTokenException("Missing bearer token");
        }
        byte[] presented = authorization.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, presented)) {
            throw new InvalidTokenException("Invalid token");
        }
    }
}
