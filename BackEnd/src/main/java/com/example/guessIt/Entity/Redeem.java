package com.example.guessIt.Entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "redeems")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@ToString
@Builder
public class Redeem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(nullable = false, length = 100, unique = true)
    private String name;
    @Column(nullable = false)
    private int cost;
}
