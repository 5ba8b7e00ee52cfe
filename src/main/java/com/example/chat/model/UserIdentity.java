package com.example.chat.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The authenticated principal carried by a token and by every session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserIdentity {
    private String id;
    private String name;
}
