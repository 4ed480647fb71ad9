package com.pulsebrief.insights.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the request trace id (from {@value #TRACE_HEADER}, generated when absent) and,
 * for tenant-scoped paths, the tenant id to the MDC and the request context. The trace
 * id is echoed on the response.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    static final String MDC_TRACE = "trace_id";
    static final String MDC_TENANT = "tenant";

    private static final Pattern TENANT_PATH = Pattern.compile("^/api/v1/tenants/([^/]+)(/.*)?$");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }
        String tenantId = tenantOf(request);
        RequestContextHolder.set(RequestContextHolder.RequestContext.builder()
                .tenantId(tenantId)
                .traceId(traceId)
                .build());
        MDC.put(MDC_TRACE, traceId);
        if (tenantId != null) {
            MDC.put(MDC_TENANT, tenantId);
        }
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE);
            MDC.remove(MDC_TENANT);
            RequestContextHolder.clear();
        }
    }

    static String tenantOf(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        Matcher matcher = TENANT_PATH.matcher(path);
        if (!matcher.matches() || matcher.group(1).isBlank()) {
            return null;
        }
        return matcher.group(1);
    }
}
