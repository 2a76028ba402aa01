package com.example.guessIt.Controller;

import com.example.guessIt.DTO.RoundStatusDTO;
import com.example.guessIt.DTO.StandingsDTO;
import com.example.guessIt.DTO.TierDTO;
import com.example.guessIt.DTO.WordlistRequest;
import com.example.guessIt.Handler.GlobalExceptionHandler.WordExistsException;
import com.example.guessIt.Service.PlayerService;
import com.example.guessIt.Service.RoundService;
import com.example.guessIt.Service.WordlistService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(GameController.class)
class GameControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RoundService roundService;

    @MockBean
    private PlayerService playerService;

    @MockBean
    private WordlistService wordlistService;

    @Test
    void roundStatusIsReturned() throws Exception {
        when(roundService.getStatus()).thenReturn(RoundStatusDTO.builder()
                .running(true)
                .category("animals")
                .pointValue(2)
                .wordsRemaining(14)
                .build());

        mockMvc.perform(get("/api/round"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.category").value("animals"))
                .andExpect(jsonPath("$.pointValue").value(2))
                .andExpect(jsonPath("$.wordsRemaining").value(14));
    }

    @Test
    void hintWithoutRoundIsConflict() throws Exception {
        when(roundService.getHint()).thenThrow(new IllegalStateException("The round has ended"));

        mockMvc.perform(get("/api/round/hint"))
                .andExpect(status().isConflict());
    }

    @Test
    void endRoundReturnsStandings() throws Exception {
        when(roundService.endRound()).thenReturn(StandingsDTO.builder()
                .first(TierDTO.builder().usernames(List.of("alice", "bob")).score(5).tokens(3).build())
                .build());

        mockMvc.perform(post("/api/round/end"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.first.usernames[0]").value("alice"))
                .andExpect(jsonPath("$.first.usernames[1]").value("bob"))
                .andExpect(jsonPath("$.first.tokens").value(3))
                .andExpect(jsonPath("$.second").doesNotExist());
    }

    @Test
    void addingWordsIsCreated() throws Exception {
        WordlistRequest request = new WordlistRequest("animals", List.of("cat", "dog"));

        mockMvc.perform(post("/api/wordlist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated());

        verify(wordlistService).addWords(any(WordlistRequest.class));
    }

    @Test
    void emptyWordListIsRejected() throws Exception {
        WordlistRequest request = new WordlistRequest("animals", List.of());

        mockMvc.perform(post("/api/wordlist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(wordlistService);
    }

    @Test
    void duplicateWordIsConflict() throws Exception {
        doThrow(new WordExistsException("cat")).when(wordlistService).addWords(any(WordlistRequest.class));

        mockMvc.perform(post("/api/wordlist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new WordlistRequest("animals", List.of("cat")))))
                .andExpect(status().isConflict())
                .andExpect(content().string("Word already exists: cat"));
    }

    @Test
    void wipingWordListIsNoContent() throws Exception {
        mockMvc.perform(delete("/api/wordlist"))
                .andExpect(status().isNoContent());

        verify(wordlistService).wipe();
    }
}
