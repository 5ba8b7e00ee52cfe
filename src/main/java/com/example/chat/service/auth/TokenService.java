package com.example.chat.service.auth;

import com.example.chat.config.AppProperties;
import com.example.chat.dto.IssuedToken;
import com.example.chat.exception.AuthenticationFailedException;
import com.example.chat.exception.TransientInfrastructureException;
import com.example.chat.model.UserIdentity;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Issues, validates and revokes signed session tokens.
 *
 * <p>Every HTTP request and every WebSocket handshake goes through {@link #authenticate(String)},
 * which checks the signature and expiry first and the revocation set second: a revoked token is
 * refused even while its signature still verifies.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenService {

    static final String NAME_CLAIM = "name";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final TokenRevocationStore revocationStore;
    private final AppProperties appProperties;
    private final Clock clock;

    public IssuedToken issue(UserIdentity identity) {
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plus(appProperties.getJwt().getTtl());
        String tokenId = UUID.randomUUID().toString();

        JwtClaimsSet claims = JwtClaimsSet.builder()
                .id(tokenId)
                .issuer(appProperties.getJwt().getIssuer())
                .subject(identity.getId())
                .claim(NAME_CLAIM, identity.getName())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
        log.debug("Issued token {} for user {} expiring at {}", tokenId, identity.getId(), expiresAt);
        return new IssuedToken(token, tokenId, expiresAt);
    }

    /**
     * Verifies signature, issuer and expiry.
     *
     * @throws AuthenticationFailedException if the token is malformed, expired or wrongly signed
     */
    public UserIdentity validate(String token) {
        Jwt jwt = decode(token);
        return toIdentity(jwt);
    }

    /**
     * Blacklists the token for the rest of its lifetime. Invalid tokens are ignored.
     */
    public void revoke(String token) {
        Jwt jwt;
        try {
            jwt = decode(token);
        } catch (AuthenticationFailedException e) {
            log.debug("Ignoring revocation of an invalid token: {}", e.getMessage());
            return;
        }
        if (jwt.getId() == null || jwt.getExpiresAt() == null) {
            return;
        }
        try {
            revocationStore.revoke(jwt.getId(), jwt.getExpiresAt());
        } catch (DataAccessException e) {
            throw new TransientInfrastructureException("Could not revoke token, please try again", e);
        }
        log.info("Revoked token {} of user {}", jwt.getId(), jwt.getSubject());
    }

    public boolean isRevoked(String token) {
        String tokenId = readTokenId(token);
        return tokenId != null && checkRevoked(tokenId);
    }

    /**
     * {@link #validate(String)} followed by the revocation check.
     */
    public UserIdentity authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationFailedException("No token provided");
        }
        Jwt jwt = decode(token);
        if (jwt.getId() != null && checkRevoked(jwt.getId())) {
            throw new AuthenticationFailedException("Token is blacklisted");
        }
        return toIdentity(jwt);
    }

    private boolean checkRevoked(String tokenId) {
        try {
            return revocationStore.isRevoked(tokenId);
        } catch (DataAccessException e) {
            throw new TransientInfrastructureException("Could not verify token, please try again", e);
        }
    }

    private Jwt decode(String token) {
        try {
            return jwtDecoder.decode(token);
        } catch (JwtException e) {
            throw new AuthenticationFailedException("Invalid token", e);
        }
    }

    private UserIdentity toIdentity(Jwt jwt) {
        String name = jwt.getClaimAsString(NAME_CLAIM);
        return new UserIdentity(jwt.getSubject(), name != null ? name : jwt.getSubject());
    }

    private String readTokenId(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        try {
            JWTClaimsSet claims = JWTParser.parse(token).getJWTClaimsSet();
            return claims.getJWTID();
        } catch (ParseException e) {
            log.debug("Unparseable token passed to revocation check: {}", e.getMessage());
            return null;
        }
    }
}
