package com.example.guessIt.Domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
public class Round {

    private String currentWord = "";
    private String currentCategory = "";
    private int pointValue;
    private boolean running;

    public void assign(String word, String category) {
        this.currentWord = word;
        this.currentCategory = category;
    }

    public void clear() {
        this.currentWord = "";
        this.currentCategory = "";
        this.pointValue = 0;
        this.running = false;
    }
}
