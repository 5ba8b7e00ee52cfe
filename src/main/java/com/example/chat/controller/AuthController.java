package com.example.chat.controller;

import com.example.chat.dto.IssuedToken;
import com.example.chat.dto.LoginRequest;
import com.example.chat.dto.LoginResponse;
import com.example.chat.exception.AuthenticationFailedException;
import com.example.chat.model.UserIdentity;
import com.example.chat.service.auth.TokenService;
import com.example.chat.service.auth.UserDirectory;
import com.example.chat.util.Constants;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class AuthController {

    private final UserDirectory userDirectory;
    private final TokenService tokenService;
    private final Scheduler chatIoScheduler;

    public AuthController(UserDirectory userDirectory, TokenService tokenService,
                          @Qualifier("chatIoScheduler") Scheduler chatIoScheduler) {
        this.userDirectory = userDirectory;
        this.tokenService = tokenService;
        this.chatIoScheduler = chatIoScheduler;
    }

    @PostMapping("/login")
    @RateLimiter(name = "loginLimiter", fallbackMethod = "loginFallback")
    public Mono<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return Mono.fromCallable(() -> {
            UserIdentity identity = userDirectory.authenticate(request.getUsername(), request.getPassword())
                    .orElseThrow(() -> new AuthenticationFailedException("Invalid credentials"));
            IssuedToken token = tokenService.issue(identity);
            log.info("User {} logged in", identity.getId());
            return new LoginResponse(token.getToken(), identity);
        }).subscribeOn(chatIoScheduler);
    }

    public Mono<LoginResponse> loginFallback(LoginRequest request, RequestNotPermitted ex) {
        log.warn("Login rate limit exceeded for user {}: {}", request.getUsername(), ex.getMessage());
        return Mono.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Too many login attempts. Please try again later."));
    }

    @PostMapping("/logout")
    public Mono<Map<String, String>> logout(@RequestAttribute(Constants.AUTH_TOKEN_ATTRIBUTE) String token,
                                            @RequestAttribute(Constants.AUTH_IDENTITY_ATTRIBUTE) UserIdentity identity) {
        return Mono.fromCallable(() -> {
            tokenService.revoke(token);
            log.info("User {} logged out", identity.getId());
            return Map.of("message", "Logged out successfully");
        }).subscribeOn(chatIoScheduler);
    }
}
