package com.cityevents.infrastructure.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Access log line per request. The {@code search_id} parameter goes into the MDC
 * so every line logged while serving the request carries it.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final String SEARCH_ID_MDC_KEY = "searchId";

    private static final Pattern API_KEY_VALUE = Pattern.compile("(^|&)(api_key=)[^&]*");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        long startTime = System.currentTimeMillis();
        String searchId = request.getParameter("search_id");
        if (isInteger(searchId)) {
            MDC.put(SEARCH_ID_MDC_KEY, searchId);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            logger.info("HTTP {} {} -> {} ({} ms)",
                    request.getMethod(),
                    maskedUri(request),
                    response.getStatus(),
                    duration);
            MDC.remove(SEARCH_ID_MDC_KEY);
        }
    }

    // Only well-formed ids go into the MDC.
    static boolean isInteger(String value) {
        if (value == null) {
            return false;
        }
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static String maskedUri(HttpServletRequest request) {
        String queryString = request.getQueryString();
        if (queryString == null || queryString.isBlank()) {
            return request.getRequestURI();
        }
        return request.getRequestURI() + "?" + maskApiKey(queryString);
    }

    static String maskApiKey(String queryString) {
        return API_KEY_VALUE.matcher(queryString).replaceAll("$1$2***");
    }
}
