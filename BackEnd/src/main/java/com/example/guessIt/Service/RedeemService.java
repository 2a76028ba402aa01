package com.example.guessIt.Service;

import com.example.guessIt.DTO.RedeemClaimDTO;
import com.example.guessIt.DTO.RedeemDTO;
import com.example.guessIt.Domain.GameStore;
import com.example.guessIt.Handler.GlobalExceptionHandler.NotEnoughTokensException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RedeemService {

    private final GameStore gameStore;

    public List<RedeemDTO> getRedeems() {
        return gameStore.getRedeems();
    }

    public void addRedeem(RedeemDTO dto) {
        gameStore.addRedeem(dto.getName(), dto.getCost());
    }

    public void modifyRedeem(String name, RedeemDTO dto) {
        gameStore.modifyRedeem(name, dto.getName(), dto.getCost());
    }

    public void removeRedeem(String name) {
        gameStore.removeRedeem(name);
    }

    /**
     * Spends the user's tokens on a redeem.
     *
     * @throws NotEnoughTokensException if the user cannot afford it
     */
    public synchronized RedeemClaimDTO redeem(String name, String username) {
        int cost = gameStore.getRedeemCost(name);
        int tokens = gameStore.getTokens(username);

        if (tokens < cost) {
            log.info("{} does not have enough tokens for {}", username, name);
            throw new NotEnoughTokensException(name, cost, tokens);
        }

        gameStore.removeTokens(username, cost);
        log.info("{} redeemed {} for {} tokens", username, name, cost);

        return RedeemClaimDTO.builder()
                .redeem(name)
                .username(username)
                .cost(cost)
                .remainingTokens(tokens - cost)
                .build();
    }
}
