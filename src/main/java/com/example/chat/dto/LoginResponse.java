package com.example.chat.dto;

import com.example.chat.model.UserIdentity;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class LoginResponse {
    private final String token;
    private final UserIdentity user;
}
