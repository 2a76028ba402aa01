package com.example.guessIt.Config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for round scoring and the round-end payout.
 *
 * Defaults match the classic rules: 1 point while more than 20 words remain,
 * 2 points for 11-20, 3 points for 10 or fewer; 3/2/1 tokens for the three
 * highscore tiers; at most 6 users in the highscore list.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "guessit.round")
public class RoundProperties {

    /** Above this many remaining words a guess is worth {@link #largePoolPoints}. */
    private int largePoolSize = 20;

    /** At or below this many remaining words a guess is worth {@link #scarcePoolPoints}. */
    private int scarcePoolSize = 10;

    private int largePoolPoints = 1;

    private int mediumPoolPoints = 2;

    private int scarcePoolPoints = 3;

    private int firstPlaceTokens = 3;

    private int secondPlaceTokens = 2;

    private int thirdPlaceTokens = 1;

    /** Cap on the highscore list, ties included. */
    private int highscoreLimit = 6;
}
