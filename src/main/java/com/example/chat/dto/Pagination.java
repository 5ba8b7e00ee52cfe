package com.example.chat.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Pagination {
    private final int count;
    private final boolean hasMore;
    private final Long oldest;
    private final Long newest;
}
