package tech.noetzold.verification_api;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a {@code trace_id} in the MDC for the whole request, so log lines and error bodies
 * can be correlated. An incoming {@code X-Request-Id} is reused when present.
 */
@Slf4j
@Component
@Order(1)
public class TraceIdFilter implements Filter {

    static final String HEADER = "X-Request-Id";

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) req;
        String traceId = httpRequest.getHeader(HEADER);
        if (traceId == null || traceId.isBlank() || traceId.length() > 64) {
            traceId = generateTraceId();
        }

        long startTime = System.currentTimeMillis();
        MDC.put("trace_id", traceId);
        try {
            if (res instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(HEADER, traceId);
            }
            chain.doFilter(req, res);
        } finally {
            log.debug("{} {} handled in {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                    System.currentTimeMillis() - startTime);
            MDC.remove("trace_id");
        }
    }

    private String generateTraceId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
