package com.example.guessIt.Controller;

import com.example.guessIt.DTO.RoundStatusDTO;
import com.example.guessIt.DTO.StandingsDTO;
import com.example.guessIt.DTO.WordlistRequest;
import com.example.guessIt.Service.PlayerService;
import com.example.guessIt.Service.RoundService;
import com.example.guessIt.Service.WordlistService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class GameController {

    private final RoundService roundService;
    private final PlayerService playerService;
    private final WordlistService wordlistService;

    /* =========================
       round
    ========================= */

    @GetMapping("/round")
    public RoundStatusDTO getRound() {
        return roundService.getStatus();
    }

    @GetMapping("/round/hint")
    public Map<String, String> getHint() {
        return Map.of("category", roundService.getHint());
    }

    @GetMapping("/round/remaining")
    public Map<String, Integer> getRemaining() {
        return Map.of("wordsRemaining", wordlistService.getRemainingWordCount());
    }

    @PostMapping("/round/end")
    public StandingsDTO endRound() {
        return roundService.endRound();
    }

    @GetMapping("/highscores")
    public StandingsDTO getHighscores() {
        return playerService.getHighscores();
    }

    /* =========================
       word list
    ========================= */

    @GetMapping("/wordlist/categories")
    public List<String> getCategories() {
        return wordlistService.getCategories();
    }

    @PostMapping("/wordlist")
    public ResponseEntity<Void> addWords(@Valid @RequestBody WordlistRequest request) {
        wordlistService.addWords(request);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @DeleteMapping("/wordlist")
    public ResponseEntity<Void> wipeWordlist() {
        wordlistService.wipe();
        return ResponseEntity.noContent().build();
    }
}
