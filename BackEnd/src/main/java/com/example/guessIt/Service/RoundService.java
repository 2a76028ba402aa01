package com.example.guessIt.Service;

import com.example.guessIt.Config.RoundProperties;
import com.example.guessIt.DTO.GuessResult;
import com.example.guessIt.DTO.Highscore;
import com.example.guessIt.DTO.RoundStatusDTO;
import com.example.guessIt.DTO.StandingsDTO;
import com.example.guessIt.Domain.GameStore;
import com.example.guessIt.Domain.RoundEngine;
import com.example.guessIt.Domain.RoundMetaKeys;
import com.example.guessIt.Domain.RoundStandings;
import com.example.guessIt.Handler.GlobalExceptionHandler.WordExistsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point to the {@link RoundEngine}. Chat messages and operator actions are
 * handled one at a time, and round outcomes are published to {@value #GAME_TOPIC}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundService {

    public static final String GAME_TOPIC = "/topic/game";

    private final RoundEngine roundEngine;
    private final GameStore gameStore;
    private final SimpMessagingTemplate messagingTemplate;
    private final RoundProperties properties;

    private final Object lock = new Object();

    /* ============================================================
       chat
    ============================================================ */

    /**
     * Checks one chat message against the hidden word. A correct guess is announced, and
     * when it was the last word the round is ended and the payout announced too.
     *
     * @return empty when no round is running
     */
    public Optional<GuessResult> handleChatMessage(String username, String message) {
        synchronized (lock) {
            if (!roundEngine.isRunning()) {
                log.debug("Round is not running, ignoring message from {}", username);
                return Optional.empty();
            }

            GuessResult result = roundEngine.process(username, message);
            if (!result.isSuccess()) {
                return Optional.of(result);
            }

            Map<String, Object> payload = new HashMap<>();
            payload.put("type", "WORD_GUESSED");
            payload.put("username", username);
            payload.put("word", result.getWord());
            payload.put("score", result.getScore());
            payload.put("wordsRemaining", result.getWordsRemaining());
            messagingTemplate.convertAndSend(GAME_TOPIC, payload);

            if (result.getWordsRemaining() == 0) {
                log.info("There are no words remaining, ending the round");
                endRoundLocked();
            }
            return Optional.of(result);
        }
    }

    /* ============================================================
       round control
    ============================================================ */

    public StandingsDTO endRound() {
        synchronized (lock) {
            return endRoundLocked();
        }
    }

    private StandingsDTO endRoundLocked() {
        List<Highscore> highscores = roundEngine.endRound();
        StandingsDTO standings = StandingsDTO.from(RoundStandings.of(highscores), properties);

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "ROUND_END");
        payload.put("standings", standings);
        messagingTemplate.convertAndSend(GAME_TOPIC, payload);

        return standings;
    }

    public RoundStatusDTO getStatus() {
        synchronized (lock) {
            return RoundStatusDTO.builder()
                    .running(roundEngine.isRunning())
                    .category(roundEngine.isRunning() ? roundEngine.getCurrentCategory() : null)
                    .pointValue(roundEngine.getPointValue())
                    .wordsRemaining(gameStore.remainingWordCount())
                    .build();
        }
    }

    /** Category of the hidden word. */
    public String getHint() {
        synchronized (lock) {
            if (!roundEngine.isRunning()) {
                throw new IllegalStateException("The round has ended, a new word list must be set");
            }
            return roundEngine.getCurrentCategory();
        }
    }

    /* ============================================================
       word pool changes
    ============================================================ */

    /**
     * Adds words to the pool, then re-prices the running round or starts a new one.
     * The word in play is no longer in the store, so it is checked here.
     *
     * @throws WordExistsException if a word is already stored or is the word in play
     */
    public void addWords(List<String> words, String category) {
        synchronized (lock) {
            if (roundEngine.isRunning()) {
                String inPlay = roundEngine.getCurrentWord();
                for (String word : words) {
                    if (word.equalsIgnoreCase(inPlay)) {
                        throw new WordExistsException(word);
                    }
                }
            }

            gameStore.addWords(words, category);
            gameStore.resetRound();

            if (roundEngine.isRunning()) {
                roundEngine.updatePointValue();
            } else {
                log.info("Starting a new round with the updated word list");
                roundEngine.restart();
            }
        }
    }

    /**
     * The word list was wiped: the round is over and its tokens are due.
     */
    public void onWordlistCleared() {
        synchronized (lock) {
            gameStore.setMeta(RoundMetaKeys.ROUND_END, "true");
            gameStore.setMeta(RoundMetaKeys.DISTRIBUTE_POINTS, "true");
            if (roundEngine.isRunning()) {
                endRoundLocked();
            }
        }
    }
}
