package com.prediction.market.settlement_engine.web;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.security.Principal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.entity.TransferStatus;
import com.prediction.market.settlement_engine.exception.AlreadyClaimedException;
import com.prediction.market.settlement_engine.exception.MarketNotResolvedException;
import com.prediction.market.settlement_engine.exception.NotBetOwnerException;
import com.prediction.market.settlement_engine.exception.SettlementPendingException;
import com.prediction.market.settlement_engine.service.ClaimService;
import com.prediction.market.settlement_engine.service.PayoutResult;
import com.prediction.market.settlement_engine.service.UnclaimedWinnings;

class ClaimControllerTest {

    private final ClaimService claimService = mock(ClaimService.class);
    private final Principal alice = () -> "alice";
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ClaimController(claimService))
                .setControllerAdvice(new SettlementExceptionHandler())
                .build();
    }

    @Test
    void claimReturnsThePayout() throws Exception {
        when(claimService.claim("b-1", "alice")).thenReturn(new PayoutResult("b-1", "m-1", Side.YES, Side.YES, true,
                new BigDecimal("176.00"), TransferStatus.CONFIRMED, "bet:b-1:payout"));

        mockMvc.perform(post("/claims/b-1").principal(alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payout").value(176.00))
                .andExpect(jsonPath("$.transferStatus").value("CONFIRMED"));
    }

    @Test
    void mapsClaimRejections() throws Exception {
        when(claimService.claim("b-2", "alice")).thenThrow(new AlreadyClaimedException("b-2"));
        when(claimService.claim("b-3", "alice")).thenThrow(new NotBetOwnerException("b-3", "alice"));
        when(claimService.claim("b-4", "alice")).thenThrow(new MarketNotResolvedException("m-4"));

        mockMvc.perform(post("/claims/b-2").principal(alice))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_CLAIMED"));
        mockMvc.perform(post("/claims/b-3").principal(alice))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
        mockMvc.perform(post("/claims/b-4").principal(alice))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NOT_RESOLVED"));
    }

    @Test
    void failedTransferCanBeRetriedWithItsToken() throws Exception {
        when(claimService.claim("b-5", "alice"))
                .thenThrow(new SettlementPendingException("b-5", "bet:b-5:payout", null));
        when(claimService.retryTransfer("b-5", "alice")).thenReturn(new PayoutResult("b-5", "m-1", Side.NO,
                Side.NO, true, new BigDecimal("20.00"), TransferStatus.CONFIRMED, "bet:b-5:payout"));

        mockMvc.perform(post("/claims/b-5").principal(alice))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.retryToken").value("bet:b-5:payout"));
        mockMvc.perform(post("/claims/b-5/retry").principal(alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transferStatus").value("CONFIRMED"));
    }

    @Test
    void listsUnclaimedWinnings() throws Exception {
        when(claimService.unclaimedWinnings("alice")).thenReturn(new UnclaimedWinnings("alice",
                new BigDecimal("20.00"), List.of(new PayoutResult("b-5", "m-1", Side.NO, Side.NO, true,
                        new BigDecimal("20.00"), null, null))));

        mockMvc.perform(get("/claims/unclaimed").principal(alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(20.00))
                .andExpect(jsonPath("$.bets[0].betId").value("b-5"));
    }
}
