package com.example.guessIt.Domain;

import com.example.guessIt.DTO.Highscore;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A highscore list split into payout tiers: everyone on the top score is first,
 * everyone above the lowest listed score is second, the rest are third.
 */
@Getter
public class RoundStandings {

    private final List<Highscore> first;
    private final List<Highscore> second;
    private final List<Highscore> third;

    private RoundStandings(List<Highscore> first, List<Highscore> second, List<Highscore> third) {
        this.first = Collections.unmodifiableList(first);
        this.second = Collections.unmodifiableList(second);
        this.third = Collections.unmodifiableList(third);
    }

    /** @param highscores ranking sorted best first */
    public static RoundStandings of(List<Highscore> highscores) {
        List<Highscore> first = new ArrayList<>();
        List<Highscore> second = new ArrayList<>();
        List<Highscore> third = new ArrayList<>();

        if (!highscores.isEmpty()) {
            int high = highscores.get(0).getScore();
            int low = highscores.get(highscores.size() - 1).getScore();

            for (Highscore entry : highscores) {
                if (entry.getScore() == high) {
                    first.add(entry);
                } else if (entry.getScore() > low) {
                    second.add(entry);
                } else {
                    third.add(entry);
                }
            }
        }
        return new RoundStandings(first, second, third);
    }

    public boolean isEmpty() {
        return first.isEmpty();
    }
}
