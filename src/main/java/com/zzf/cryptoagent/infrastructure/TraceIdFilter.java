package com.zzf.cryptoagent.infrastructure;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts {@code traceId} and, for per-user routes, {@code userId} into the logging MDC.
 */
@Component
public final class TraceIdFilter extends OncePerRequestFilter {
    private static final Pattern USER_PATH = Pattern.compile("^/api/(?:mcp|wallet)/([^/]+)");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String traceId = request.getHeader("X-Trace-Id");
        if (traceId == null || traceId.trim().isEmpty()) {
            traceId = "trace-" + UUID.randomUUID();
        }
        MDC.put("traceId", traceId);
        Matcher m = USER_PATH.matcher(request.getRequestURI());
        if (m.find()) {
            MDC.put("userId", m.group(1));
        }
        response.setHeader("X-Trace-Id", traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("traceId");
            MDC.remove("userId");
        }
    }
}
