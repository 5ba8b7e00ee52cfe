package com.example.chat.controller;

import com.example.chat.config.AppProperties;
import com.example.chat.config.BearerAuthenticationFilter;
import com.example.chat.config.CaffeineConfig;
import com.example.chat.config.JwtConfig;
import com.example.chat.dto.LoginRequest;
import com.example.chat.exception.GlobalExceptionHandler;
import com.example.chat.service.auth.CaffeineTokenRevocationStore;
import com.example.chat.service.auth.TokenService;
import com.example.chat.service.auth.UserDirectory;
import com.fasterxml.jackson.databind.JsonNode;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuthControllerTest {

    private TokenService tokenService;
    private AuthController authController;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        AppProperties.UserEntry alice = new AppProperties.UserEntry();
        alice.setPassword("pass1");
        alice.setName("Alice");
        appProperties.getUsers().put("user1", alice);

        Clock clock = Clock.systemUTC();
        SecretKey key = new SecretKeySpec(appProperties.getJwt().getSecret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        tokenService = new TokenService(
                new NimbusJwtEncoder(new ImmutableSecret<>(key)),
                JwtConfig.createDecoder(key, appProperties.getJwt().getIssuer(), clock),
                new CaffeineTokenRevocationStore(CaffeineConfig.buildRevokedTokensCache(100, clock), clock),
                appProperties,
                clock);

        authController = new AuthController(new UserDirectory(appProperties), tokenService, Schedulers.immediate());
        webTestClient = WebTestClient.bindToController(authController)
                .controllerAdvice(new GlobalExceptionHandler())
                .webFilter(new BearerAuthenticationFilter(tokenService, Jackson2ObjectMapperBuilder.json().build(), Schedulers.immediate()))
                .build();
    }

    private String login() {
        JsonNode response = webTestClient.post().uri("/api/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("username", "user1", "password", "pass1"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult()
                .getResponseBody();
        assertThat(response).isNotNull();
        return response.get("token").asText();
    }

    @Test
    void login_ReturnsTokenAndUser() {
        webTestClient.post().uri("/api/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("username", "user1", "password", "pass1"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.token").isNotEmpty()
                .jsonPath("$.user.id").isEqualTo("user1")
                .jsonPath("$.user.name").isEqualTo("Alice");
    }

    @Test
    void login_IssuedTokenAuthenticates() {
        String token = login();

        assertThat(tokenService.authenticate(token).getId()).isEqualTo("user1");
    }

    @Test
    void login_Returns401ForWrongPassword() {
        webTestClient.post().uri("/api/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("username", "user1", "password", "nope"))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Invalid credentials");
    }

    @Test
    void login_Returns400WhenFieldsAreMissing() {
        webTestClient.post().uri("/api/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("username", "user1"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Username and password required");
    }

    @Test
    void logout_RevokesTheToken() {
        String token = login();

        webTestClient.post().uri("/api/logout")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Logged out successfully");

        assertThat(tokenService.isRevoked(token)).isTrue();

        webTestClient.post().uri("/api/logout")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Token is blacklisted");
    }

    @Test
    void logout_RequiresAToken() {
        webTestClient.post().uri("/api/logout")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.message").isEqualTo("No token provided");
    }

    @Test
    void loginFallback_Answers429() {
        RequestNotPermitted rejected = RequestNotPermitted.createRequestNotPermitted(RateLimiter.ofDefaults("loginLimiter"));

        StepVerifier.create(authController.loginFallback(new LoginRequest("user1", "pass1"), rejected))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ResponseStatusException.class);
                    assertThat(((ResponseStatusException) e).getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                })
                .verify();
    }
}
