package com.example.guessIt.DTO;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class TierDTO {
    private List<String> usernames;
    private int score;
    private int tokens;
}
