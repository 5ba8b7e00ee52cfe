package com.example.chat.controller;

import com.example.chat.config.BearerAuthenticationFilter;
import com.example.chat.dto.HistoryMessage;
import com.example.chat.dto.HistoryPage;
import com.example.chat.dto.HistoryQuery;
import com.example.chat.dto.Pagination;
import com.example.chat.exception.AuthenticationFailedException;
import com.example.chat.exception.GlobalExceptionHandler;
import com.example.chat.exception.InvalidRequestException;
import com.example.chat.exception.ResourceNotFoundException;
import com.example.chat.exception.RoomAlreadyExistsException;
import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.model.ChatMessage;
import com.example.chat.model.HistorySource;
import com.example.chat.model.MessageType;
import com.example.chat.model.Room;
import com.example.chat.model.UserIdentity;
import com.example.chat.service.auth.TokenService;
import com.example.chat.service.history.HistoryComposer;
import com.example.chat.service.room.RoomService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoomControllerTest {

    private static final String TOKEN = "good-token";

    private RoomService roomService;
    private HistoryComposer historyComposer;
    private TokenService tokenService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        roomService = mock(RoomService.class);
        historyComposer = mock(HistoryComposer.class);
        tokenService = mock(TokenService.class);
        when(tokenService.authenticate(any())).thenThrow(new AuthenticationFailedException("Invalid token"));
        doReturn(new UserIdentity("user1", "Alice")).when(tokenService).authenticate(TOKEN);

        BearerAuthenticationFilter filter = new BearerAuthenticationFilter(
                tokenService, Jackson2ObjectMapperBuilder.json().build(), Schedulers.immediate());
        webTestClient = WebTestClient
                .bindToController(new RoomController(roomService, historyComposer, Schedulers.immediate()))
                .controllerAdvice(new GlobalExceptionHandler())
                .webFilter(filter)
                .build();
    }

    private WebTestClient.RequestHeadersSpec<?> authorizedGet(String uri) {
        return webTestClient.get().uri(uri).header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN);
    }

    @Test
    void listRooms_ReturnsAllRooms() {
        when(roomService.list()).thenReturn(List.of(
                Room.builder().id("general").name("General").created(1L).createdBy("system").build(),
                Room.builder().id("tech").name("Tech").created(2L).createdBy("system").build()));

        authorizedGet("/api/rooms")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].id").isEqualTo("general")
                .jsonPath("$[1].name").isEqualTo("Tech");
    }

    @Test
    void createRoom_Returns201WithCreatorFromToken() {
        when(roomService.create("Project X", "user1"))
                .thenReturn(Room.builder().id("project-x").name("Project X").created(5L).createdBy("user1").build());

        webTestClient.post().uri("/api/rooms")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "Project X"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo("project-x")
                .jsonPath("$.createdBy").isEqualTo("user1");
    }

    @Test
    void createRoom_Returns409ForExistingRoom() {
        when(roomService.create("General", "user1")).thenThrow(new RoomAlreadyExistsException("general"));

        webTestClient.post().uri("/api/rooms")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "General"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Room already exists");
    }

    @Test
    void createRoom_Returns400ForBlankName() {
        webTestClient.post().uri("/api/rooms")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "  "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Room name is required");

        verify(roomService, never()).create(anyString(), anyString());
    }

    @Test
    void createRoom_Returns400ForOverlongName() {
        webTestClient.post().uri("/api/rooms")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "x".repeat(300)))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Room name must be at most 100 characters");

        verify(roomService, never()).create(anyString(), anyString());
    }

    @Test
    void createRoom_Returns400WhenServiceRejectsName() {
        when(roomService.create("!!", "user1")).thenThrow(new InvalidRequestException("Room name is required"));

        webTestClient.post().uri("/api/rooms")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "!!"))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void getRoom_Returns404ForUnknownRoom() {
        when(roomService.get("nope")).thenThrow(new ResourceNotFoundException("Room not found"));

        authorizedGet("/api/rooms/nope")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404)
                .jsonPath("$.message").isEqualTo("Room not found");
    }

    @Test
    void requestsWithoutTokenAreRejected() {
        webTestClient.get().uri("/api/rooms")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.status").isEqualTo(401)
                .jsonPath("$.message").isEqualTo("Invalid token");

        verify(roomService, never()).list();
    }

    @Test
    void requestsWithBadTokenAreRejected() {
        webTestClient.get().uri("/api/rooms")
                .header(HttpHeaders.AUTHORIZATION, "Bearer forged")
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void tokenStoreOutageReturns503() {
        doThrow(new TransientInfrastructureException("Could not verify token, please try again", new RuntimeException()))
                .when(tokenService).authenticate("flaky");

        webTestClient.get().uri("/api/rooms")
                .header(HttpHeaders.AUTHORIZATION, "Bearer flaky")
                .exchange()
                .expectStatus().isEqualTo(503);
    }

    @Test
    void getMessages_PassesCursorsAndSourceHint() {
        ChatMessage message = ChatMessage.builder()
                .id("m1").type(MessageType.MESSAGE).roomId("general").content("hi")
                .userId("user1").username("Alice").timestamp(100L)
                .build();
        when(historyComposer.history(any())).thenReturn(new HistoryPage(
                List.of(new HistoryMessage(message, HistorySource.CACHE)),
                new Pagination(1, false, 100L, 100L)));

        authorizedGet("/api/rooms/general/messages?limit=10&before=200&after=50&source=redis")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.messages[0].id").isEqualTo("m1")
                .jsonPath("$.messages[0].content").isEqualTo("hi")
                .jsonPath("$.messages[0].source").isEqualTo("cache")
                .jsonPath("$.pagination.count").isEqualTo(1)
                .jsonPath("$.pagination.hasMore").isEqualTo(false);

        ArgumentCaptor<HistoryQuery> query = ArgumentCaptor.forClass(HistoryQuery.class);
        verify(historyComposer).history(query.capture());
        assertThat(query.getValue().getRoomId()).isEqualTo("general");
        assertThat(query.getValue().getLimit()).isEqualTo(10);
        assertThat(query.getValue().getBefore()).isEqualTo(200L);
        assertThat(query.getValue().getAfter()).isEqualTo(50L);
        assertThat(query.getValue().getSource()).isEqualTo(HistorySource.CACHE);
    }

    @Test
    void getMessages_UnknownSourceMeansCombined() {
        when(historyComposer.history(any())).thenReturn(new HistoryPage(List.of(), new Pagination(0, false, null, null)));

        authorizedGet("/api/rooms/general/messages?source=whatever")
                .exchange()
                .expectStatus().isOk();

        ArgumentCaptor<HistoryQuery> query = ArgumentCaptor.forClass(HistoryQuery.class);
        verify(historyComposer).history(query.capture());
        assertThat(query.getValue().getSource()).isNull();
        assertThat(query.getValue().getLimit()).isNull();
    }

    @Test
    void getArchivedHistory_ReadsTheArchiveOnly() {
        when(historyComposer.history(any())).thenReturn(new HistoryPage(List.of(), new Pagination(0, false, null, null)));

        authorizedGet("/api/rooms/general/history?limit=5&before=300")
                .exchange()
                .expectStatus().isOk();

        ArgumentCaptor<HistoryQuery> query = ArgumentCaptor.forClass(HistoryQuery.class);
        verify(historyComposer).history(query.capture());
        assertThat(query.getValue().getSource()).isEqualTo(HistorySource.ARCHIVE);
        assertThat(query.getValue().getBefore()).isEqualTo(300L);
    }

    @Test
    void getMessages_Returns404ForUnknownRoom() {
        when(historyComposer.history(any())).thenThrow(new ResourceNotFoundException("Room not found"));

        authorizedGet("/api/rooms/nope/messages")
                .exchange()
                .expectStatus().isNotFound();
    }
}
