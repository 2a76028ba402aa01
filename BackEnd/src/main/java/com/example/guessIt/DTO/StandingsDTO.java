package com.example.guessIt.DTO;

import com.example.guessIt.Config.RoundProperties;
import com.example.guessIt.Domain.RoundStandings;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class StandingsDTO {
    // null when nobody has points
    private TierDTO first;
    private TierDTO second;
    private TierDTO third;

    public static StandingsDTO from(RoundStandings standings, RoundProperties properties) {
        return StandingsDTO.builder()
                .first(tier(standings.getFirst(), properties.getFirstPlaceTokens()))
                .second(tier(standings.getSecond(), properties.getSecondPlaceTokens()))
                .third(tier(standings.getThird(), properties.getThirdPlaceTokens()))
                .build();
    }

    private static TierDTO tier(List<Highscore> users, int tokens) {
        if (users.isEmpty()) {
            return null;
        }
        return TierDTO.builder()
                .usernames(users.stream().map(Highscore::getUsername).toList())
                .score(users.get(0).getScore())
                .tokens(tokens)
                .build();
    }
}
