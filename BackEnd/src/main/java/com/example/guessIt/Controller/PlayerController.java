package com.example.guessIt.Controller;

import com.example.guessIt.DTO.MigrateUserRequest;
import com.example.guessIt.DTO.TokenAdjustRequest;
import com.example.guessIt.Service.PlayerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/users")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class PlayerController {

    private final PlayerService playerService;

    @GetMapping("/{username}/score")
    public Map<String, Object> getScore(@PathVariable String username) {
        return Map.of("username", username, "score", playerService.getScore(username));
    }

    @GetMapping("/{username}/tokens")
    public Map<String, Object> getTokens(@PathVariable String username) {
        return Map.of("username", username, "tokens", playerService.getTokens(username));
    }

    @PostMapping("/{username}/tokens")
    public Map<String, Object> adjustTokens(@PathVariable String username, @RequestBody TokenAdjustRequest request) {
        int balance = playerService.adjustTokens(username, request.getAmount());
        return Map.of("username", username, "tokens", balance);
    }

    @PostMapping("/migrate")
    public ResponseEntity<Void> migrate(@Valid @RequestBody MigrateUserRequest request) {
        playerService.migrateUser(request.getOldUsername(), request.getNewUsername());
        return ResponseEntity.ok().build();
    }
}
