package com.github.dimitryivaniuta.datacache.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Puts the request's correlation id into MDC (log pattern prints it) and echoes it back.
 * Cache population triggered by a request is therefore traceable in the logs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9._-]+$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String corr = sanitize(request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER));

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }

    static String sanitize(String incoming) {
        if (incoming == null || incoming.isBlank()
                || incoming.length() > RequestContextKeys.CORRELATION_ID_MAX_LENGTH
                || !SAFE_ID.matcher(incoming).matches()) {
            return UUID.randomUUID().toString();
        }
        return incoming;
    }
}
