package com.example.guessIt.DTO;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of checking one chat message against the current word.
 * {@code word} and {@code score} are null when the message did not contain the word.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GuessResult {
    private final boolean success;
    private final String word;
    private final Integer score;
    private final int wordsRemaining;

    public static GuessResult miss(int wordsRemaining) {
        return new GuessResult(false, null, null, wordsRemaining);
    }

    public static GuessResult hit(String word, int score, int wordsRemaining) {
        return new GuessResult(true, word, score, wordsRemaining);
    }
}
