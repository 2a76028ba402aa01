package com.example.guessIt.DTO;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class MigrateUserRequest {
    @NotBlank
    private String oldUsername;
    @NotBlank
    private String newUsername;
}
