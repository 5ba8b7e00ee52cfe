package com.example.chat.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class HistoryPage {
    private final List<HistoryMessage> messages;
    private final Pagination pagination;
}
