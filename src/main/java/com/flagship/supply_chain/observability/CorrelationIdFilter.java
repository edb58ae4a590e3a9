package com.flagship.supply_chain.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Binds a correlation id to every API request and echoes it on the response.
 *
 * Runs first so that rejections logged by the lifecycle service and the exception
 * handler carry the id. All MDC keys are cleared when the request completes, including
 * any transition keys left behind by a failed call.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = CorrelationContext.bindCorrelationId(
            request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clearAll();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Health checks hit actuator every few seconds
        return !request.getRequestURI().startsWith("/api/");
    }
}
