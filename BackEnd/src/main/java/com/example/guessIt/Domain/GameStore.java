package com.example.guessIt.Domain;

import com.example.guessIt.DTO.Highscore;
import com.example.guessIt.DTO.RedeemDTO;
import com.example.guessIt.DTO.WordEntry;
import com.example.guessIt.Entity.UserAccount;
import com.example.guessIt.Handler.GlobalExceptionHandler.MetaNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent storage behind the guessing game: the word list, user scores and tokens,
 * redeems, and the meta map used to restore a round after a restart.
 *
 * <p>Words, users, categories, redeems and meta names are matched case-insensitively.
 * Failures are reported with the exceptions nested in
 * {@link com.example.guessIt.Handler.GlobalExceptionHandler}.
 */
public interface GameStore {

    /* =========================
       word list
    ========================= */

    /** All words not yet played, with their category. Empty when the pool is exhausted. */
    List<WordEntry> getWords();

    /**
     * Deletes a word. Its category is deleted too once no word refers to it.
     *
     * @throws com.example.guessIt.Handler.GlobalExceptionHandler.WordNotFoundException if absent
     */
    void removeWord(String word);

    int remainingWordCount();

    String getCategory(String word);

    List<String> getCategories();

    void addCategory(String category);

    void removeCategory(String category);

    void addWord(String word, String category);

    /** Adds all words under the category, creating it when needed. Nothing is added on a duplicate. */
    void addWords(List<String> words, String category);

    /** Replaces every word and category with the given category-to-words map. */
    void setWordlist(Map<String, List<String>> wordlist);

    /* =========================
       users
    ========================= */

    Optional<UserAccount> findUser(String username);

    void addUser(String username, int score, int tokens);

    void addScore(String username, int amount);

    /** Score of the user, 0 for unknown users. */
    int getScore(String username);

    /**
     * Users holding one of the three highest distinct non-zero scores, best first,
     * capped at the configured limit.
     */
    List<Highscore> getHighscores();

    void resetScores();

    /** Tokens of the user, 0 for unknown users. */
    int getTokens(String username);

    void setTokens(String username, int amount);

    /** Adds (or with a negative amount removes) tokens; the balance is clamped at 0. */
    void addTokens(String username, int amount);

    void removeTokens(String username, int amount);

    /** Moves score and tokens of {@code oldUsername} onto {@code newUsername} and deletes the old account. */
    void migrateUser(String oldUsername, String newUsername);

    /* =========================
       redeems
    ========================= */

    List<RedeemDTO> getRedeems();

    int getRedeemCost(String name);

    void addRedeem(String name, int cost);

    void modifyRedeem(String name, String newName, int newCost);

    void removeRedeem(String name);

    /* =========================
       meta
    ========================= */

    Optional<String> findMeta(String name);

    default String getMeta(String name) {
        return findMeta(name).orElseThrow(() -> new MetaNotFoundException(name));
    }

    void setMeta(String name, String data);

    /** Flags the saved round as still playable with a changed word pool. */
    void resetRound();
}
