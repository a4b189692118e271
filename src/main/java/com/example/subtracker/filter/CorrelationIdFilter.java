package com.example.subtracker.filter;

import com.example.subtracker.util.Constants;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with a correlation id for logging. EventSub deliveries reuse their
 * message id so a redelivery can be matched to the original attempt in the logs.
 */
@Component
@Order(1)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        try {
            String correlationId = getOrCreateCorrelationId(request);
            MDC.put(Constants.Mdc.CORRELATION_ID, correlationId);
            response.setHeader(Constants.Headers.CORRELATION_ID, correlationId);

            filterChain.doFilter(request, response);
        } finally {
            MDC.clear();
        }
    }

    private String getOrCreateCorrelationId(HttpServletRequest request) {
        String correlationId = request.getHeader(Constants.Headers.CORRELATION_ID);
        if (correlationId == null || correlationId.isEmpty()) {
            correlationId = request.getHeader(Constants.Headers.MESSAGE_ID);
        }
        if (correlationId == null || correlationId.isEmpty()) {
            correlationId = UUID.randomUUID().toString();
        }
        return correlationId;
    }
}
