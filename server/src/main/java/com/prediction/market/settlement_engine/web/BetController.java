package com.prediction.market.settlement_engine.web;

import java.security.Principal;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.service.BetExecutionService;
import com.prediction.market.settlement_engine.service.MarketService;
import com.prediction.market.settlement_engine.web.dto.PlaceBetRequest;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/bets")
@Validated
public class BetController {

    private final BetExecutionService betExecutionService;
    private final MarketService marketService;

    public BetController(BetExecutionService betExecutionService, MarketService marketService) {
        this.betExecutionService = betExecutionService;
        this.marketService = marketService;
    }

    @PostMapping
    public ResponseEntity<Bet> placeBet(@Valid @RequestBody PlaceBetRequest request, Principal principal) {
        Bet bet = betExecutionService.placeBet(request.marketId(), principal.getName(), request.side(),
                request.grossAmount(), request.nonce());
        return ResponseEntity.ok(bet);
    }

    @GetMapping("/mine")
    public List<Bet> myBets(Principal principal) {
        return marketService.betsForUser(principal.getName());
    }
}
