package com.example.chat.config;

import com.example.chat.dto.ErrorResponse;
import com.example.chat.exception.AuthenticationFailedException;
import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.model.UserIdentity;
import com.example.chat.service.auth.TokenService;
import com.example.chat.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;

/**
 * Requires a valid, non-revoked bearer token on every {@code /api/**} request except login.
 * The authenticated identity and the raw token are exposed as exchange attributes.
 */
@Component
@Order(0)
@Slf4j
public class BearerAuthenticationFilter implements WebFilter {

    private static final String API_PREFIX = "/api/";
    private static final String LOGIN_PATH = "/api/login";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final ObjectMapper objectMapper;
    private final Scheduler chatIoScheduler;

    public BearerAuthenticationFilter(TokenService tokenService, ObjectMapper objectMapper,
                                      @Qualifier("chatIoScheduler") Scheduler chatIoScheduler) {
        this.tokenService = tokenService;
        this.objectMapper = objectMapper;
        this.chatIoScheduler = chatIoScheduler;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!path.startsWith(API_PREFIX) || path.equals(LOGIN_PATH)) {
            return chain.filter(exchange);
        }

        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        String token = header != null && header.startsWith(BEARER_PREFIX)
                ? header.substring(BEARER_PREFIX.length()).trim()
                : null;

        return Mono.fromCallable(() -> tokenService.authenticate(token))
                .subscribeOn(chatIoScheduler)
                .flatMap(identity -> proceed(exchange, chain, identity, token))
                .onErrorResume(AuthenticationFailedException.class, e -> {
                    log.debug("Rejected {} {}: {}", exchange.getRequest().getMethod(), path, e.getMessage());
                    return reject(exchange, HttpStatus.UNAUTHORIZED, e.getMessage());
                })
                .onErrorResume(TransientInfrastructureException.class, e -> {
                    log.error("Token check unavailable for {} {}: {}", exchange.getRequest().getMethod(), path, e.getMessage());
                    return reject(exchange, HttpStatus.SERVICE_UNAVAILABLE, Constants.ErrorText.SERVICE_UNAVAILABLE);
                });
    }

    private Mono<Void> proceed(ServerWebExchange exchange, WebFilterChain chain, UserIdentity identity, String token) {
        exchange.getAttributes().put(Constants.AUTH_IDENTITY_ATTRIBUTE, identity);
        exchange.getAttributes().put(Constants.AUTH_TOKEN_ATTRIBUTE, token);
        return chain.filter(exchange);
    }

    private Mono<Void> reject(ServerWebExchange exchange, HttpStatus status, String message) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.empty();
        }
        ErrorResponse body = new ErrorResponse(ZonedDateTime.now(), status.value(), status.getReasonPhrase(),
                message, exchange.getRequest().getPath().toString());
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            bytes = ("{\"status\":" + status.value() + "}").getBytes(StandardCharsets.UTF_8);
        }
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
