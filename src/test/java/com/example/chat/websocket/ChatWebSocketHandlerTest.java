package com.example.chat.websocket;

import com.example.chat.exception.AuthenticationFailedException;
import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.model.UserIdentity;
import com.example.chat.service.auth.TokenService;
import com.example.chat.service.gateway.ChatGateway;
import com.example.chat.service.gateway.ChatSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatWebSocketHandlerTest {

    private TokenService tokenService;
    private ChatGateway chatGateway;
    private WebSocketSession webSocketSession;
    private ChatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        tokenService = mock(TokenService.class);
        chatGateway = mock(ChatGateway.class);
        webSocketSession = mock(WebSocketSession.class);
        when(webSocketSession.close(any())).thenReturn(Mono.empty());
        when(webSocketSession.textMessage(anyString())).thenAnswer(invocation -> text(invocation.getArgument(0)));
        handler = new ChatWebSocketHandler(tokenService, chatGateway, new ObjectMapper(), Schedulers.immediate(), Clock.systemUTC());
    }

    private static WebSocketMessage text(String payload) {
        return new WebSocketMessage(WebSocketMessage.Type.TEXT,
                DefaultDataBufferFactory.sharedInstance.wrap(payload.getBytes(StandardCharsets.UTF_8)));
    }

    private void connectWithToken(String token) {
        HandshakeInfo info = new HandshakeInfo(URI.create("ws://localhost:3000/ws?token=" + token),
                new HttpHeaders(), Mono.empty(), null);
        when(webSocketSession.getHandshakeInfo()).thenReturn(info);
    }

    @Test
    void rejectedTokenClosesWith4001() {
        connectWithToken("bad");
        when(tokenService.authenticate("bad")).thenThrow(new AuthenticationFailedException("Invalid token"));

        StepVerifier.create(handler.handle(webSocketSession)).verifyComplete();

        verify(webSocketSession).close(new CloseStatus(4001, "Authentication failed"));
        verify(chatGateway, never()).open(any());
    }

    @Test
    void unavailableTokenStoreClosesWithServerError() {
        connectWithToken("any");
        when(tokenService.authenticate("any"))
                .thenThrow(new TransientInfrastructureException("Could not verify token, please try again", new RuntimeException()));

        StepVerifier.create(handler.handle(webSocketSession)).verifyComplete();

        verify(webSocketSession).close(CloseStatus.SERVER_ERROR);
        verify(chatGateway, never()).open(any());
    }

    @Test
    void inboundFramesReachTheGatewayAndCloseDisconnects() {
        connectWithToken("good");
        UserIdentity alice = new UserIdentity("user1", "Alice");
        when(tokenService.authenticate("good")).thenReturn(alice);
        ChatSession session = new ChatSession("s1", alice, 16, 0L);
        session.markAuthenticated();
        session.activate();
        when(chatGateway.open(alice)).thenReturn(session);
        String joinFrame = "{\"type\":\"join\",\"roomId\":\"general\"}";
        when(webSocketSession.receive()).thenReturn(Flux.just(text(joinFrame)));
        when(webSocketSession.send(any())).thenAnswer(invocation -> {
            Publisher<WebSocketMessage> outbound = invocation.getArgument(0);
            return Flux.from(outbound).then();
        });

        StepVerifier.create(handler.handle(webSocketSession)).expectComplete().verify(Duration.ofSeconds(5));

        verify(chatGateway).handle(session, joinFrame);
        verify(chatGateway, atLeastOnce()).disconnect(session);
    }
}
