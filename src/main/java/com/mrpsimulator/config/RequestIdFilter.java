package com.mrpsimulator.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

@Slf4j
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-ID";
    public static final String MDC_KEY = "requestId";

    @Value("${mrp.http.slow-request-ms:2000}")
    private long slowRequestMs;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request);
        request.setAttribute(MDC_KEY, requestId);
        response.setHeader(HEADER, requestId);
        MDC.put(MDC_KEY, requestId);
        long started = System.currentTimeMillis();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsed = System.currentTimeMillis() - started;
            if (elapsed > slowRequestMs) {
                log.warn("Slow request | method={} | path={} | status={} | elapsedMs={}",
                         request.getMethod(), request.getRequestURI(), response.getStatus(), elapsed);
            } else {
                log.debug("{} {} | status={} | elapsedMs={}",
                          request.getMethod(), request.getRequestURI(), response.getStatus(), elapsed);
            }
            MDC.remove(MDC_KEY);
        }
    }

    public static String resolveRequestId(HttpServletRequest request) {
        Object assigned = request.getAttribute(MDC_KEY);
        if (assigned instanceof String id) {
            return id;
        }
        String existing = request.getHeader(HEADER);
        return (existing != null && !existing.isBlank()) ? existing : UUID.randomUUID().toString();
    }
}
