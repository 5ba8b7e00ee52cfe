package com.example.chat.config;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * HS256 signing and verification of session tokens.
 */
@Configuration
public class JwtConfig {

    @Bean
    public SecretKey chatTokenKey(AppProperties appProperties) {
        byte[] secret = appProperties.getJwt().getSecret().getBytes(StandardCharsets.UTF_8);
        if (secret.length < 32) {
            throw new IllegalStateException("chat.jwt.secret must be at least 32 bytes for HS256");
        }
        return new SecretKeySpec(secret, "HmacSHA256");
    }

    @Bean
    public JwtEncoder jwtEncoder(SecretKey chatTokenKey) {
        return new NimbusJwtEncoder(new ImmutableSecret<>(chatTokenKey));
    }

    @Bean
    public JwtDecoder jwtDecoder(SecretKey chatTokenKey, AppProperties appProperties, Clock clock) {
        return createDecoder(chatTokenKey, appProperties.getJwt().getIssuer(), clock);
    }

    /**
     * Expiry is enforced with zero clock skew so that a token is dead exactly at its {@code exp}.
     */
    public static JwtDecoder createDecoder(SecretKey key, String issuer, Clock clock) {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        JwtTimestampValidator timestampValidator = new JwtTimestampValidator(Duration.ZERO);
        timestampValidator.setClock(clock);
        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
                timestampValidator,
                new JwtIssuerValidator(issuer)));
        return decoder;
    }
}
