package com.example.chat.websocket;

import com.example.chat.exception.AuthenticationFailedException;
import com.example.chat.model.UserIdentity;
import com.example.chat.service.auth.TokenService;
import com.example.chat.service.gateway.ChatGateway;
import com.example.chat.service.gateway.ChatSession;
import com.example.chat.util.Constants;
import com.example.chat.websocket.frame.ServerFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * WebSocket endpoint. Authenticates the handshake token, then pumps inbound frames into the
 * {@link ChatGateway} one at a time and the session's outbound frames and pings to the client.
 */
@Component
@Slf4j
public class ChatWebSocketHandler implements WebSocketHandler {

    private static final CloseStatus AUTHENTICATION_FAILED =
            new CloseStatus(Constants.CLOSE_AUTHENTICATION_FAILED, "Authentication failed");
    private static final byte[] PING_PAYLOAD = "ping".getBytes(StandardCharsets.UTF_8);

    private final TokenService tokenService;
    private final ChatGateway chatGateway;
    private final ObjectMapper objectMapper;
    private final Scheduler chatIoScheduler;
    private final Clock clock;

    public ChatWebSocketHandler(TokenService tokenService, ChatGateway chatGateway, ObjectMapper objectMapper,
                                @Qualifier("chatIoScheduler") Scheduler chatIoScheduler, Clock clock) {
        this.tokenService = tokenService;
        this.chatGateway = chatGateway;
        this.objectMapper = objectMapper;
        this.chatIoScheduler = chatIoScheduler;
        this.clock = clock;
    }

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        String token = UriComponentsBuilder.fromUri(webSocketSession.getHandshakeInfo().getUri())
                .build()
                .getQueryParams()
                .getFirst("token");

        return Mono.fromCallable(() -> tokenService.authenticate(token))
                .subscribeOn(chatIoScheduler)
                .onErrorResume(AuthenticationFailedException.class, e -> {
                    log.info("WebSocket handshake rejected from {}: {}",
                            webSocketSession.getHandshakeInfo().getRemoteAddress(), e.getMessage());
                    return webSocketSession.close(AUTHENTICATION_FAILED).then(Mono.<UserIdentity>empty());
                })
                .onErrorResume(e -> {
                    log.error("WebSocket authentication unavailable: {}", e.getMessage());
                    return webSocketSession.close(CloseStatus.SERVER_ERROR).then(Mono.<UserIdentity>empty());
                })
                .flatMap(identity -> serve(webSocketSession, identity));
    }

    private Mono<Void> serve(WebSocketSession webSocketSession, UserIdentity identity) {
        ChatSession session = chatGateway.open(identity);
        session.onTerminate(() -> webSocketSession.close(CloseStatus.GOING_AWAY).subscribe());

        Flux<WebSocketMessage> outbound = Flux.merge(
                session.frames()
                        .flatMap(frame -> Mono.justOrEmpty(toJson(session, frame)))
                        .map(webSocketSession::textMessage),
                session.pings()
                        .map(tick -> webSocketSession.pingMessage(factory -> factory.wrap(PING_PAYLOAD))));

        Mono<Void> inbound = webSocketSession.receive()
                .doOnNext(message -> session.markAlive(clock.millis()))
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(payload -> Mono.fromRunnable(() -> chatGateway.handle(session, payload))
                        .subscribeOn(chatIoScheduler))
                .doOnError(e -> log.warn("Transport error on session {}: {}", session.getId(), e.getMessage()))
                .doFinally(signal -> scheduleDisconnect(session))
                .then();

        return Mono.zip(inbound, webSocketSession.send(outbound))
                .then()
                .doFinally(signal -> scheduleDisconnect(session));
    }

    private void scheduleDisconnect(ChatSession session) {
        chatIoScheduler.schedule(() -> chatGateway.disconnect(session));
    }

    private String toJson(ChatSession session, ServerFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} frame for session {}: {}", frame.getType(), session.getId(), e.getMessage());
            return null;
        }
    }
}
