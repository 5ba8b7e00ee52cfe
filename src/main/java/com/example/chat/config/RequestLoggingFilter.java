package com.example.chat.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Tags each request with a correlation id (taken from {@code X-Correlation-ID} or generated),
 * echoes it on the response and logs the request timing.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestLoggingFilter implements WebFilter {

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    static final String CORRELATION_ID_KEY = "correlation_id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isEmpty()) {
            correlationId = UUID.randomUUID().toString();
        }
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        long startTime = System.currentTimeMillis();
        String path = exchange.getRequest().getURI().getPath();
        String method = exchange.getRequest().getMethod().name();
        String requestCorrelationId = correlationId;

        MDC.put(CORRELATION_ID_KEY, correlationId);
        if (log.isDebugEnabled()) {
            log.debug("Incoming request: {} {} from {}", method, path, exchange.getRequest().getRemoteAddress());
        }
        return chain.filter(exchange)
                .doFinally(signalType -> {
                    MDC.put(CORRELATION_ID_KEY, requestCorrelationId);
                    if (log.isDebugEnabled()) {
                        log.debug("Outgoing response: {} {} - {} in {}ms",
                                method, path, exchange.getResponse().getStatusCode(), System.currentTimeMillis() - startTime);
                    }
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }
}
