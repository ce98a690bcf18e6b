package com.prediction.market.settlement_engine.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.MarketStatus;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.exception.AlreadyResolvedException;
import com.prediction.market.settlement_engine.exception.InvalidResolutionException;
import com.prediction.market.settlement_engine.exception.MarketNotFoundException;
import com.prediction.market.settlement_engine.service.BetQuote;
import com.prediction.market.settlement_engine.service.MarketService;
import com.prediction.market.settlement_engine.service.MarketView;
import com.prediction.market.settlement_engine.service.ResolutionService;

class MarketControllerTest {

    private final MarketService marketService = mock(MarketService.class);
    private final ResolutionService resolutionService = mock(ResolutionService.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new MarketController(marketService, resolutionService))
                .setControllerAdvice(new SettlementExceptionHandler())
                .build();
    }

    @Test
    void createsMarket() throws Exception {
        Market market = Market.builder().id("m-1").build();
        when(marketService.createMarket("Rain?", null, "creator-1", 1_800_000_000_000L, null)).thenReturn(market);
        when(marketService.toView(market)).thenReturn(view("m-1", MarketStatus.OPEN, null));

        mockMvc.perform(post("/markets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Rain?\",\"creatorId\":\"creator-1\",\"endDate\":1800000000000}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("m-1"))
                .andExpect(jsonPath("$.yesPrice").value(0.5));
    }

    @Test
    void unknownMarketIsNotFound() throws Exception {
        when(marketService.view("nope")).thenThrow(new MarketNotFoundException("nope"));

        mockMvc.perform(get("/markets/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("MARKET_NOT_FOUND"));
    }

    @Test
    void quotesWithLenientSide() throws Exception {
        BetQuote quote = new BetQuote("m-1", Side.NO, new BigDecimal("10.00"), new BigDecimal("0.5"),
                new BigDecimal("2"), new BigDecimal("0.20"), new BigDecimal("1.00"), new BigDecimal("8.80"),
                new BigDecimal("17.60"));
        when(marketService.quote("m-1", Side.NO, new BigDecimal("10"))).thenReturn(quote);

        mockMvc.perform(get("/markets/m-1/quote").param("side", "no").param("amount", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.potentialPayout").value(17.60));
        mockMvc.perform(get("/markets/m-1/quote").param("side", "maybe").param("amount", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_BET"));
        mockMvc.perform(get("/markets/m-1/quote").param("side", "yes"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void resolvesAndReportsConflicts() throws Exception {
        Market resolved = Market.builder().id("m-1").status(MarketStatus.RESOLVED).outcome(Side.YES).build();
        when(resolutionService.resolve("m-1", Side.YES, "final")).thenReturn(resolved);
        when(marketService.toView(resolved)).thenReturn(view("m-1", MarketStatus.RESOLVED, Side.YES));
        when(resolutionService.resolve(eq("m-2"), any(), any()))
                .thenThrow(new AlreadyResolvedException("m-2", Side.NO));
        when(resolutionService.resolve(eq("m-3"), any(), any()))
                .thenThrow(new InvalidResolutionException("m-3", "outcome is required (YES or NO)"));

        mockMvc.perform(patch("/markets/m-1/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outcome\":\"YES\",\"note\":\"final\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.outcome").value("YES"));
        mockMvc.perform(patch("/markets/m-2/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outcome\":\"YES\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_RESOLVED"));
        mockMvc.perform(patch("/markets/m-3/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_RESOLUTION"));
    }

    private static MarketView view(String id, MarketStatus status, Side outcome) {
        return new MarketView(id, "Rain?", null, "creator-1", new BigDecimal("1000.00"), new BigDecimal("1000.00"),
                new BigDecimal("0.5"), new BigDecimal("0.5"), BigDecimal.ZERO, status, outcome,
                1_800_000_000_000L, null, null, null, null, 0);
    }
}
