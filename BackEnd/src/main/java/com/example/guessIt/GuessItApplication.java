package com.example.guessIt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuessItApplication {

	public static void main(String[] args) {
		SpringApplication.run(GuessItApplication.class, args);
	}

}
