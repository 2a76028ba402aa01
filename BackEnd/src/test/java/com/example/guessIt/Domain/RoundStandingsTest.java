package com.example.guessIt.Domain;

import com.example.guessIt.DTO.Highscore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RoundStandingsTest {

    @Test
    void splitsIntoThreeTiers() {
        RoundStandings standings = RoundStandings.of(List.of(
                new Highscore("a", 5),
                new Highscore("b", 5),
                new Highscore("c", 4),
                new Highscore("d", 3)));

        assertThat(standings.getFirst()).extracting(Highscore::getUsername).containsExactly("a", "b");
        assertThat(standings.getSecond()).extracting(Highscore::getUsername).containsExactly("c");
        assertThat(standings.getThird()).extracting(Highscore::getUsername).containsExactly("d");
    }

    @Test
    void twoScoresHaveNoMiddleTier() {
        RoundStandings standings = RoundStandings.of(List.of(
                new Highscore("a", 5),
                new Highscore("b", 2),
                new Highscore("c", 2)));

        assertThat(standings.getFirst()).hasSize(1);
        assertThat(standings.getSecond()).isEmpty();
        assertThat(standings.getThird()).hasSize(2);
    }

    @Test
    void singleScoreIsAllFirst() {
        RoundStandings standings = RoundStandings.of(List.of(new Highscore("a", 1), new Highscore("b", 1)));

        assertThat(standings.getFirst()).hasSize(2);
        assertThat(standings.getSecond()).isEmpty();
        assertThat(standings.getThird()).isEmpty();
    }

    @Test
    void emptyRanking() {
        assertThat(RoundStandings.of(List.of()).isEmpty()).isTrue();
    }
}
