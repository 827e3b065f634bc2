package com.pgpulse.web;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every API request with a trace id, taken from {@code X-Request-Id} when the caller sends a
 * usable one. The id is echoed back and put into the MDC for log lines and error responses.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {
    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String MDC_TRACE_ID = "trace_id";

    // Caller-supplied ids end up in log lines.
    private static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (!(request instanceof HttpServletRequest httpRequest)) {
            chain.doFilter(request, response);
            return;
        }

        String traceId = resolveTraceId(httpRequest.getHeader(TRACE_ID_HEADER));
        MDC.put(MDC_TRACE_ID, traceId);
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader(TRACE_ID_HEADER, traceId);
        }

        long startedAt = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            if (log.isDebugEnabled()) {
                int status = response instanceof HttpServletResponse r ? r.getStatus() : 0;
                log.debug("Request completed: method={}, path={}, status={}, duration_ms={}",
                        httpRequest.getMethod(), httpRequest.getRequestURI(), status,
                        (System.nanoTime() - startedAt) / 1_000_000);
            }
            MDC.remove(MDC_TRACE_ID);
        }
    }

    static String resolveTraceId(String header) {
        if (header != null && ACCEPTED_TRACE_ID.matcher(header).matches()) {
            return header;
        }
        return UUID.randomUUID().toString();
    }
}
