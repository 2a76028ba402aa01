package com.example.guessIt.Controller;

import com.example.guessIt.DTO.ChatMessageDTO;
import com.example.guessIt.Service.RoundService;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

/**
 * Entry point for chat relays: every non-command chat line is sent here.
 */
@Controller
@RequiredArgsConstructor
public class SocketChatController {

    private final RoundService roundService;

    @MessageMapping("/chat/message")
    public void chatMessage(@Payload ChatMessageDTO dto) {
        if (dto.getUsername() == null || dto.getUsername().isBlank() || dto.getMessage() == null) {
            return;
        }
        roundService.handleChatMessage(dto.getUsername(), dto.getMessage());
    }
}
