package com.example.guessIt.Service;

import com.example.guessIt.DTO.WordlistRequest;
import com.example.guessIt.Domain.GameStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class WordlistService {

    private final GameStore gameStore;
    private final RoundService roundService;

    public int getRemainingWordCount() {
        return gameStore.remainingWordCount();
    }

    public List<String> getCategories() {
        return gameStore.getCategories();
    }

    public void addWords(WordlistRequest request) {
        List<String> words = request.getWords().stream().map(String::trim).toList();
        roundService.addWords(words, request.getCategory().trim());
    }

    public void wipe() {
        log.info("Wiping the word list");
        gameStore.setWordlist(Map.of());
        roundService.onWordlistCleared();
    }
}
