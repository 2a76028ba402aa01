package com.example.guessIt.DTO;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RedeemClaimDTO {
    private String redeem;
    private String username;
    private int cost;
    private int remainingTokens;
}
