package com.example.guessIt.Domain;

import com.example.guessIt.Config.RoundProperties;
import com.example.guessIt.DTO.GuessResult;
import com.example.guessIt.DTO.Highscore;
import com.example.guessIt.DTO.WordEntry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.example.guessIt.Domain.RoundMetaKeys.*;

/**
 * Drives the guessing round: picks hidden words, scores guesses, pays out tokens when
 * the round ends, and saves/restores the round through the {@link GameStore} meta map.
 *
 * <p>Not thread-safe. Callers serialise access (see
 * {@link com.example.guessIt.Service.RoundService}).
 */
@Slf4j
@Component
public class RoundEngine {

    private final GameStore gameStore;
    private final RoundProperties properties;
    private final Random random;

    private final Round round = new Round();

    @Autowired
    public RoundEngine(GameStore gameStore, RoundProperties properties) {
        this(gameStore, properties, new Random());
    }

    RoundEngine(GameStore gameStore, RoundProperties properties, Random random) {
        this.gameStore = gameStore;
        this.properties = properties;
        this.random = random;
    }

    /* =========================
       lifecycle
    ========================= */

    /**
     * Restores the round from the meta flags left by the previous run.
     * Pays out a round whose payout was interrupted, resumes a saved word,
     * or draws a new one.
     */
    @PostConstruct
    public void start() {
        round.clear();

        boolean updateRound = readFlag(UPDATE_ROUND);
        boolean roundEnd = readFlag(ROUND_END);
        boolean distributePoints = readFlag(DISTRIBUTE_POINTS);
        Optional<Round> snapshot = roundEnd ? Optional.empty() : loadSnapshot();

        RoundRecovery recovery = RoundRecovery.of(roundEnd, distributePoints, snapshot.isPresent());
        log.info("Starting round engine: {}", recovery);

        switch (recovery) {
            case ENDED_PENDING_PAYOUT:
                log.info("Previous round ended before its payout, distributing tokens");
                endRound();
                break;
            case ENDED:
                log.info("Previous round has ended, waiting for a new word list");
                break;
            case RESUMING:
                Round saved = snapshot.get();
                round.assign(saved.getCurrentWord(), saved.getCurrentCategory());
                round.setPointValue(saved.getPointValue());
                if (updateRound) {
                    log.info("Word pool changed since the last run, recalculating point value");
                    updatePointValue();
                }
                round.setRunning(true);
                break;
            default:
                if (chooseNewWord()) {
                    updatePointValue();
                    round.setRunning(true);
                } else {
                    log.info("Word list is empty, round cannot begin");
                }
        }
    }

    /**
     * Saves the round so the next {@link #start()} resumes it exactly.
     */
    @PreDestroy
    public void teardown() {
        if (!round.isRunning()) {
            log.info("Round is not running, marking it ended");
            gameStore.setMeta(ROUND_END, "true");
            gameStore.setMeta(DISTRIBUTE_POINTS, "false");
            gameStore.setMeta(UPDATE_ROUND, "false");
            return;
        }

        log.info("Saving current round: {} ({})", round.getCurrentWord(), round.getCurrentCategory());
        gameStore.setMeta(CURRENT_WORD, round.getCurrentWord());
        gameStore.setMeta(CURRENT_CATEGORY, round.getCurrentCategory());
        gameStore.setMeta(CURRENT_POINTS, String.valueOf(round.getPointValue()));
        gameStore.setMeta(ROUND_END, "false");
        gameStore.setMeta(DISTRIBUTE_POINTS, "false");
        gameStore.setMeta(UPDATE_ROUND, "false");
    }

    /**
     * Runs {@link #start()} again on an engine whose round is over,
     * typically after new words were added.
     */
    public void restart() {
        if (round.isRunning()) {
            throw new IllegalStateException("Round is already running");
        }
        start();
    }

    /* =========================
       word selection & scoring
    ========================= */

    /**
     * Draws a word uniformly at random and removes it from the store.
     *
     * @return false when the store has no words left; the round is left untouched
     */
    public boolean chooseNewWord() {
        List<WordEntry> words = gameStore.getWords();
        if (words.isEmpty()) {
            log.info("No words left to choose from");
            return false;
        }

        WordEntry picked = words.get(random.nextInt(words.size()));
        round.assign(picked.getWord(), picked.getCategory());
        gameStore.removeWord(picked.getWord());

        log.debug("Chose a new word from category {}", picked.getCategory());
        return true;
    }

    /**
     * Scarcer pools are worth more: 1 point above 20 remaining words,
     * 2 points for 11-20, 3 points for 10 or fewer (configurable).
     */
    public void updatePointValue() {
        int remaining = gameStore.remainingWordCount();

        if (remaining > properties.getLargePoolSize()) {
            round.setPointValue(properties.getLargePoolPoints());
        } else if (remaining > properties.getScarcePoolSize()) {
            round.setPointValue(properties.getMediumPoolPoints());
        } else {
            round.setPointValue(properties.getScarcePoolPoints());
        }
        log.debug("{} words remaining, point value is {}", remaining, round.getPointValue());
    }

    /**
     * Checks a chat message for the current word.
     *
     * <p>Containment is a plain case-sensitive substring test, so the word also wins
     * inside a longer token. On a hit the sender is credited and the next word is drawn,
     * unless that was the last one; ending the round is then up to the caller.
     *
     * @return the result; {@code wordsRemaining} counts the word in play on a miss and
     *         the words still to guess on a hit
     */
    public GuessResult process(String username, String message) {
        if (!round.isRunning()) {
            throw new IllegalStateException("Round is not running");
        }

        // the word in play was already removed from the store
        int wordsRemaining = gameStore.remainingWordCount() + 1;

        if (message == null || !message.contains(round.getCurrentWord())) {
            return GuessResult.miss(wordsRemaining);
        }

        String word = round.getCurrentWord();
        int points = round.getPointValue();
        log.info("{} guessed the word {} for {} points", username, word, points);

        creditScore(username, points);

        GuessResult result = GuessResult.hit(word, points, wordsRemaining - 1);
        if (result.getWordsRemaining() == 0) {
            log.info("No words remaining");
            return result;
        }

        chooseNewWord();
        updatePointValue();
        return result;
    }

    private void creditScore(String username, int points) {
        if (gameStore.findUser(username).isPresent()) {
            gameStore.addScore(username, points);
        } else {
            log.info("First score for {}, creating account", username);
            gameStore.addUser(username, points, 0);
        }
    }

    /* =========================
       round end
    ========================= */

    /**
     * Pays tokens to the highscore tiers, resets every score and stops the round.
     *
     * @return the ranking as it was before scores were reset
     */
    public List<Highscore> endRound() {
        log.info("Ending the round");

        List<Highscore> highscores = gameStore.getHighscores();
        distributeTokens(RoundStandings.of(highscores));

        gameStore.resetScores();

        gameStore.setMeta(ROUND_END, "true");
        gameStore.setMeta(DISTRIBUTE_POINTS, "false");
        gameStore.setMeta(CURRENT_WORD, "");
        gameStore.setMeta(CURRENT_CATEGORY, "");
        gameStore.setMeta(CURRENT_POINTS, "0");
        round.clear();

        return highscores;
    }

    private void distributeTokens(RoundStandings standings) {
        if (standings.isEmpty()) {
            log.info("No users scored any points");
            return;
        }
        standings.getFirst().forEach(h -> gameStore.addTokens(h.getUsername(), properties.getFirstPlaceTokens()));
        standings.getSecond().forEach(h -> gameStore.addTokens(h.getUsername(), properties.getSecondPlaceTokens()));
        standings.getThird().forEach(h -> gameStore.addTokens(h.getUsername(), properties.getThirdPlaceTokens()));
    }

    /* =========================
       helpers
    ========================= */

    private boolean readFlag(String name) {
        return gameStore.findMeta(name).map(Boolean::parseBoolean).orElse(false);
    }

    private Optional<Round> loadSnapshot() {
        Optional<String> word = gameStore.findMeta(CURRENT_WORD);
        Optional<String> category = gameStore.findMeta(CURRENT_CATEGORY);
        Optional<String> points = gameStore.findMeta(CURRENT_POINTS);

        if (word.isEmpty() || category.isEmpty() || points.isEmpty() || word.get().isEmpty()) {
            log.info("No saved round to resume");
            return Optional.empty();
        }

        Round saved = new Round();
        saved.assign(word.get(), category.get());
        saved.setPointValue(Integer.parseInt(points.get()));
        return Optional.of(saved);
    }

    /* =========================
       round state
    ========================= */

    public boolean isRunning() {
        return round.isRunning();
    }

    public String getCurrentWord() {
        return round.getCurrentWord();
    }

    public String getCurrentCategory() {
        return round.getCurrentCategory();
    }

    public int getPointValue() {
        return round.getPointValue();
    }
}
