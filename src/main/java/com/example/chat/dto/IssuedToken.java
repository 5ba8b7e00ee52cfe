package com.example.chat.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class IssuedToken {
    private final String token;
    private final String tokenId;
    private final Instant expiresAt;
}
