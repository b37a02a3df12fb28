package com.phillippitts.grillstats.config.logging;

import com.phillippitts.grillstats.util.LogSanitizer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>clientId: the dashboard identity from X-Client-ID (if present)</li>
 *   <li>deviceId: the first path segment after {@code /api/stream/} or {@code /api/devices/}
 *       (if present), so SSE subscriptions and connect/disconnect calls log against their device</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>Header and path values are stripped of control characters and truncated.</p>
 *
 * <p>The context is always cleared after the request to avoid leakage across threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CLIENT_ID_HEADER = "X-Client-ID";
    private static final String[] DEVICE_PATH_PREFIXES = {"/api/stream/", "/api/devices/"};

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                ThreadContext.put("requestId", headerOrGenerate(http, REQUEST_ID_HEADER));

                String clientId = http.getHeader(CLIENT_ID_HEADER);
                if (clientId != null && !clientId.isBlank()) {
                    ThreadContext.put("clientId", LogSanitizer.id(clientId));
                }

                String deviceId = deviceIdFromPath(http.getRequestURI());
                if (deviceId != null) {
                    ThreadContext.put("deviceId", deviceId);
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : LogSanitizer.id(v);
    }

    static String deviceIdFromPath(String uri) {
        if (uri == null) {
            return null;
        }
        for (String prefix : DEVICE_PATH_PREFIXES) {
            if (uri.startsWith(prefix)) {
                String rest = uri.substring(prefix.length());
                int slash = rest.indexOf('/');
                String segment = slash < 0 ? rest : rest.substring(0, slash);
                return segment.isBlank() ? null : LogSanitizer.id(segment);
            }
        }
        return null;
    }
}
