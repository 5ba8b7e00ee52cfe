package com.example.chat.dto;

import com.example.chat.util.Constants;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateRoomRequest {
    @NotBlank(message = "Room name is required")
    @Size(max = Constants.ROOM_NAME_MAX_LENGTH, message = Constants.ErrorText.ROOM_NAME_TOO_LONG)
    private String name;
}
