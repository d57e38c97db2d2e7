package com.phillippitts.windowanalysis.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Puts request correlation keys into the Log4j2 ThreadContext for the duration of one HTTP request.
 *
 * <p>{@code requestId} comes from {@code X-Request-ID} (generated when absent) and is echoed back on
 * the response so a client can quote it. {@code sessionId} is taken from {@code X-Session-ID} when
 * present. {@code method} and {@code uri} are always set. Nothing is left behind once the request ends.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String SESSION_ID_HEADER = "X-Session-ID";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (!StringUtils.hasText(requestId)) {
            requestId = UUID.randomUUID().toString();
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);

        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("requestId", requestId);
        keys.put("method", request.getMethod());
        keys.put("uri", request.getRequestURI());
        String sessionId = request.getHeader(SESSION_ID_HEADER);
        if (StringUtils.hasText(sessionId)) {
            keys.put("sessionId", sessionId);
        }

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(keys)) {
            chain.doFilter(request, response);
        }
    }
}
