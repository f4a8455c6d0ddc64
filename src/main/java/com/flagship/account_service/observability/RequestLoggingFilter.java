package com.flagship.account_service.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags each request with a correlation id and writes one access log line when it completes.
 *
 * The id comes from the X-Correlation-ID request header, or is generated, and is
 * echoed back in the response header. Both MDC keys of {@link LogContext} are
 * removed before the worker thread is released.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final int MAX_CORRELATION_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        long start = System.currentTimeMillis();
        String correlationId = correlationIdOf(request);
        MDC.put(LogContext.CORRELATION_ID_KEY, correlationId);
        response.setHeader(LogContext.CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            log.info("http_request method={} path={} status={} duration_ms={}",
                    request.getMethod(),
                    request.getRequestURI(),
                    response.getStatus(),
                    System.currentTimeMillis() - start);
            MDC.remove(LogContext.CORRELATION_ID_KEY);
            LogContext.clearAccountId();
        }
    }

    private String correlationIdOf(HttpServletRequest request) {
        String header = request.getHeader(LogContext.CORRELATION_ID_HEADER);
        if (header == null || header.isBlank() || header.length() > MAX_CORRELATION_ID_LENGTH) {
            return UUID.randomUUID().toString().substring(0, 8);
        }
        return header.trim();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // health checks would drown the access log
        return request.getRequestURI().startsWith("/actuator");
    }
}
