package com.example.guessIt.Service;

import com.example.guessIt.Config.RoundProperties;
import com.example.guessIt.DTO.StandingsDTO;
import com.example.guessIt.Domain.GameStore;
import com.example.guessIt.Domain.RoundStandings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerService {

    private final GameStore gameStore;
    private final RoundProperties properties;

    public int getScore(String username) {
        return gameStore.getScore(username);
    }

    public int getTokens(String username) {
        return gameStore.getTokens(username);
    }

    public StandingsDTO getHighscores() {
        return StandingsDTO.from(RoundStandings.of(gameStore.getHighscores()), properties);
    }

    /**
     * Adds tokens, or removes them when {@code amount} is negative. The balance is clamped by the store.
     *
     * @return the new balance
     */
    public int adjustTokens(String username, int amount) {
        gameStore.addTokens(username, amount);
        return gameStore.getTokens(username);
    }

    public void migrateUser(String oldUsername, String newUsername) {
        if (oldUsername.equalsIgnoreCase(newUsername)) {
            throw new IllegalArgumentException("Old and new username are the same");
        }
        gameStore.migrateUser(oldUsername, newUsername);
    }
}
