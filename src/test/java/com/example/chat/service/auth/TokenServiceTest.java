package com.example.chat.service.auth;

import com.example.chat.config.AppProperties;
import com.example.chat.config.CaffeineConfig;
import com.example.chat.config.JwtConfig;
import com.example.chat.dto.IssuedToken;
import com.example.chat.exception.AuthenticationFailedException;
import com.example.chat.model.UserIdentity;
import com.example.chat.support.MutableClock;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenServiceTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-42";

    private MutableClock clock;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        AppProperties appProperties = new AppProperties();
        appProperties.getJwt().setTtl(Duration.ofHours(1));
        tokenService = newTokenService(SECRET, appProperties);
    }

    private TokenService newTokenService(String secret, AppProperties appProperties) {
        SecretKey key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        CaffeineTokenRevocationStore store = new CaffeineTokenRevocationStore(
                CaffeineConfig.buildRevokedTokensCache(1000, clock), clock);
        return new TokenService(
                new NimbusJwtEncoder(new ImmutableSecret<>(key)),
                JwtConfig.createDecoder(key, appProperties.getJwt().getIssuer(), clock),
                store,
                appProperties,
                clock);
    }

    @Test
    void issue_ThenValidate_ReturnsSameIdentity() {
        IssuedToken issued = tokenService.issue(new UserIdentity("user1", "Alice"));

        UserIdentity identity = tokenService.validate(issued.getToken());

        assertThat(identity.getId()).isEqualTo("user1");
        assertThat(identity.getName()).isEqualTo("Alice");
        assertThat(issued.getExpiresAt()).isEqualTo(Instant.parse("2024-05-01T11:00:00Z"));
        assertThat(issued.getTokenId()).isNotBlank();
    }

    @Test
    void authenticate_RejectsRevokedTokenWhileSignatureStillVerifies() {
        String token = tokenService.issue(new UserIdentity("user1", "Alice")).getToken();

        tokenService.revoke(token);

        assertThat(tokenService.isRevoked(token)).isTrue();
        assertThat(tokenService.validate(token).getId()).isEqualTo("user1");
        assertThatThrownBy(() -> tokenService.authenticate(token))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Token is blacklisted");
    }

    @Test
    void revokedToken_StaysRefusedAfterExpiryAsExpired() {
        String token = tokenService.issue(new UserIdentity("user1", "Alice")).getToken();
        tokenService.revoke(token);

        clock.advance(Duration.ofHours(1).plusSeconds(1));

        assertThat(tokenService.isRevoked(token)).isFalse();
        assertThatThrownBy(() -> tokenService.authenticate(token))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid token");
    }

    @Test
    void authenticate_RejectsExpiredToken() {
        String token = tokenService.issue(new UserIdentity("user2", "Bob")).getToken();

        clock.advance(Duration.ofMinutes(61));

        assertThatThrownBy(() -> tokenService.authenticate(token))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid token");
    }

    @Test
    void authenticate_RejectsMissingToken() {
        assertThatThrownBy(() -> tokenService.authenticate(null))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("No token provided");
        assertThatThrownBy(() -> tokenService.authenticate("  "))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("No token provided");
    }

    @Test
    void authenticate_RejectsTokenSignedWithAnotherKey() {
        TokenService foreign = newTokenService("another-secret-another-secret-another", new AppProperties());
        String token = foreign.issue(new UserIdentity("user1", "Alice")).getToken();

        assertThatThrownBy(() -> tokenService.authenticate(token))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid token");
    }

    @Test
    void authenticate_RejectsGarbage() {
        assertThatThrownBy(() -> tokenService.authenticate("not-a-jwt"))
                .isInstanceOf(AuthenticationFailedException.class);
        assertThat(tokenService.isRevoked("not-a-jwt")).isFalse();
    }

    @Test
    void revoke_IgnoresInvalidToken() {
        tokenService.revoke("not-a-jwt");

        assertThat(tokenService.isRevoked("not-a-jwt")).isFalse();
    }

    @Test
    void revocationIsPerToken() {
        String first = tokenService.issue(new UserIdentity("user1", "Alice")).getToken();
        String second = tokenService.issue(new UserIdentity("user1", "Alice")).getToken();

        tokenService.revoke(first);

        assertThat(tokenService.authenticate(second).getId()).isEqualTo("user1");
    }
}
