package com.example.guessIt.DTO;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RoundStatusDTO {
    private boolean running;
    private String category;
    private int pointValue;
    private int wordsRemaining;
}
