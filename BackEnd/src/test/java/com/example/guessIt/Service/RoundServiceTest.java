package com.example.guessIt.Service;

import com.example.guessIt.Config.RoundProperties;
import com.example.guessIt.DTO.GuessResult;
import com.example.guessIt.DTO.Highscore;
import com.example.guessIt.DTO.StandingsDTO;
import com.example.guessIt.Domain.GameStore;
import com.example.guessIt.Domain.RoundEngine;
import com.example.guessIt.Domain.RoundMetaKeys;
import com.example.guessIt.Handler.GlobalExceptionHandler.WordExistsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoundServiceTest {

    @Mock
    private RoundEngine roundEngine;

    @Mock
    private GameStore gameStore;

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    private RoundService roundService;

    @BeforeEach
    void setUp() {
        roundService = new RoundService(roundEngine, gameStore, messagingTemplate, new RoundProperties());
    }

    @Test
    void messagesAreIgnoredWhileNoRoundRuns() {
        when(roundEngine.isRunning()).thenReturn(false);

        assertThat(roundService.handleChatMessage("alice", "cat")).isEmpty();

        verify(roundEngine, never()).process(anyString(), anyString());
        verifyNoInteractions(messagingTemplate);
    }

    @Test
    void missIsNotAnnounced() {
        when(roundEngine.isRunning()).thenReturn(true);
        when(roundEngine.process("alice", "hello")).thenReturn(GuessResult.miss(4));

        Optional<GuessResult> result = roundService.handleChatMessage("alice", "hello");

        assertThat(result).hasValueSatisfying(r -> assertThat(r.isSuccess()).isFalse());
        verifyNoInteractions(messagingTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void correctGuessIsAnnounced() {
        when(roundEngine.isRunning()).thenReturn(true);
        when(roundEngine.process("alice", "a cat")).thenReturn(GuessResult.hit("cat", 2, 5));

        roundService.handleChatMessage("alice", "a cat");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq(RoundService.GAME_TOPIC), payload.capture());
        Map<String, Object> sent = (Map<String, Object>) payload.getValue();
        assertThat(sent)
                .containsEntry("type", "WORD_GUESSED")
                .containsEntry("username", "alice")
                .containsEntry("word", "cat")
                .containsEntry("score", 2)
                .containsEntry("wordsRemaining", 5);
        verify(roundEngine, never()).endRound();
    }

    @Test
    void lastWordEndsTheRound() {
        when(roundEngine.isRunning()).thenReturn(true);
        when(roundEngine.process("alice", "cat")).thenReturn(GuessResult.hit("cat", 3, 0));
        when(roundEngine.endRound()).thenReturn(List.of(new Highscore("alice", 9), new Highscore("bob", 3)));

        roundService.handleChatMessage("alice", "cat");

        verify(roundEngine).endRound();
        verify(messagingTemplate, times(2)).convertAndSend(eq(RoundService.GAME_TOPIC), any(Object.class));
    }

    @Test
    void endRoundReportsTiers() {
        when(roundEngine.endRound()).thenReturn(List.of(
                new Highscore("a", 5), new Highscore("b", 4), new Highscore("c", 1)));

        StandingsDTO standings = roundService.endRound();

        assertThat(standings.getFirst().getUsernames()).containsExactly("a");
        assertThat(standings.getFirst().getTokens()).isEqualTo(3);
        assertThat(standings.getSecond().getUsernames()).containsExactly("b");
        assertThat(standings.getThird().getUsernames()).containsExactly("c");
        assertThat(standings.getThird().getTokens()).isEqualTo(1);
    }

    @Test
    void hintNeedsRunningRound() {
        when(roundEngine.isRunning()).thenReturn(false);

        assertThatThrownBy(() -> roundService.getHint()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void addedWordsRepriceRunningRound() {
        when(roundEngine.isRunning()).thenReturn(true);
        when(roundEngine.getCurrentWord()).thenReturn("cat");

        roundService.addWords(List.of("dog", "owl"), "animals");

        verify(gameStore).addWords(List.of("dog", "owl"), "animals");
        verify(gameStore).resetRound();
        verify(roundEngine).updatePointValue();
        verify(roundEngine, never()).restart();
    }

    @Test
    void addedWordsStartEndedRound() {
        when(roundEngine.isRunning()).thenReturn(false);

        roundService.addWords(List.of("cat"), "animals");

        verify(gameStore).addWords(List.of("cat"), "animals");
        verify(roundEngine).restart();
    }

    @Test
    void wordInPlayCannotBeAddedAgain() {
        when(roundEngine.isRunning()).thenReturn(true);
        when(roundEngine.getCurrentWord()).thenReturn("cat");

        assertThatThrownBy(() -> roundService.addWords(List.of("dog", "Cat"), "animals"))
                .isInstanceOf(WordExistsException.class)
                .hasMessage("Word already exists: Cat");

        verify(gameStore, never()).addWords(anyList(), anyString());
        verify(gameStore, never()).resetRound();
        verify(roundEngine, never()).updatePointValue();
    }

    @Test
    void clearedWordlistEndsRunningRound() {
        when(roundEngine.isRunning()).thenReturn(true);
        when(roundEngine.endRound()).thenReturn(List.of());

        roundService.onWordlistCleared();

        verify(gameStore).setMeta(RoundMetaKeys.ROUND_END, "true");
        verify(gameStore).setMeta(RoundMetaKeys.DISTRIBUTE_POINTS, "true");
        verify(roundEngine).endRound();
    }
}
