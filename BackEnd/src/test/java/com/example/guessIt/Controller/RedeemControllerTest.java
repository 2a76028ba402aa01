package com.example.guessIt.Controller;

import com.example.guessIt.DTO.RedeemDTO;
import com.example.guessIt.Handler.GlobalExceptionHandler.NotEnoughTokensException;
import com.example.guessIt.Service.RedeemService;
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

@WebMvcTest(RedeemController.class)
class RedeemControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RedeemService redeemService;

    @Test
    void redeemsAreListed() throws Exception {
        when(redeemService.getRedeems()).thenReturn(List.of(new RedeemDTO("hydrate", 5)));

        mockMvc.perform(get("/api/redeems"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("hydrate"))
                .andExpect(jsonPath("$[0].cost").value(5));
    }

    @Test
    void negativeCostIsRejected() throws Exception {
        mockMvc.perform(post("/api/redeems")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"hydrate\", \"cost\": -1}"))
                .andExpect(status().isBadRequest());

        verify(redeemService, never()).addRedeem(any(RedeemDTO.class));
    }

    @Test
    void redeemWithoutTokensIsConflict() throws Exception {
        when(redeemService.redeem("hydrate", "alice")).thenThrow(new NotEnoughTokensException("hydrate", 5, 2));

        mockMvc.perform(post("/api/redeems/hydrate/redeem")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\": \"alice\"}"))
                .andExpect(status().isConflict());
    }
}
