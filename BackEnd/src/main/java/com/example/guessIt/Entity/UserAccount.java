package com.example.guessIt.Entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "users")
public class UserAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String username;

    @Column(nullable = false)
    private int score;

    @Column(nullable = false)
    private int tokens;

    public void addScore(int amount) {
        this.score += amount;
    }

    public void addTokens(int amount) {
        this.tokens = clampTokens((long) this.tokens + amount);
    }

    public void removeTokens(int amount) {
        this.tokens = clampTokens((long) this.tokens - amount);
    }

    // balance stays within 0..Integer.MAX_VALUE
    private static int clampTokens(long balance) {
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, balance));
    }
}
