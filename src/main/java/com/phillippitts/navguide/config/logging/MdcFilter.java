package com.phillippitts.navguide.config.logging;

import com.phillippitts.navguide.util.LogSanitizer;
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
 * Tags each API request with the camera client it came from.
 *
 * <p>MDC keys: {@code requestId} (X-Request-ID or a generated UUID), {@code deviceId}
 * (X-Device-ID), {@code frameId} (X-Frame-ID, the client's frame sequence number),
 * {@code method} and {@code uri}. Client-supplied values are whitespace-collapsed and cut
 * to {@value #MAX_CLIENT_VALUE_CHARS} characters. The session adds {@code sessionId} itself
 * while it processes a frame.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String DEVICE_ID_HEADER = "X-Device-ID";
    static final String FRAME_ID_HEADER = "X-Frame-ID";
    static final int MAX_CLIENT_VALUE_CHARS = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = clientValue(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId != null ? requestId : UUID.randomUUID().toString());
                putIfPresent("deviceId", clientValue(http, DEVICE_ID_HEADER));
                putIfPresent("frameId", clientValue(http, FRAME_ID_HEADER));
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String clientValue(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        if (v == null || v.isBlank()) {
            return null;
        }
        return LogSanitizer.preview(v.trim(), MAX_CLIENT_VALUE_CHARS);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            ThreadContext.put(key, value);
        }
    }
}
