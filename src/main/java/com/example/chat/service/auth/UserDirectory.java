package com.example.chat.service.auth;

import com.example.chat.config.AppProperties;
import com.example.chat.model.UserIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Fixed identity table loaded from {@code chat.users}.
 */
@Service
@RequiredArgsConstructor
public class UserDirectory {

    private final AppProperties appProperties;

    public Optional<UserIdentity> authenticate(String username, String password) {
        if (username == null || password == null) {
            return Optional.empty();
        }
        AppProperties.UserEntry entry = appProperties.getUsers().get(username);
        if (entry == null || entry.getPassword() == null) {
            return Optional.empty();
        }
        boolean matches = MessageDigest.isEqual(
                entry.getPassword().getBytes(StandardCharsets.UTF_8),
                password.getBytes(StandardCharsets.UTF_8));
        return matches ? Optional.of(new UserIdentity(username, entry.getName())) : Optional.empty();
    }
}
