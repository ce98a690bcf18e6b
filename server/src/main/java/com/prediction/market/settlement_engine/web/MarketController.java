package com.prediction.market.settlement_engine.web;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.settlement_engine.entity.Bet;
import com.prediction.market.settlement_engine.entity.Market;
import com.prediction.market.settlement_engine.entity.Side;
import com.prediction.market.settlement_engine.exception.InvalidBetException;
import com.prediction.market.settlement_engine.service.BetQuote;
import com.prediction.market.settlement_engine.service.MarketService;
import com.prediction.market.settlement_engine.service.MarketView;
import com.prediction.market.settlement_engine.service.ResolutionService;
import com.prediction.market.settlement_engine.web.dto.CreateMarketRequest;
import com.prediction.market.settlement_engine.web.dto.FeeOverrideRequest;
import com.prediction.market.settlement_engine.web.dto.ResolveMarketRequest;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/markets")
@Validated
public class MarketController {

    private final MarketService marketService;
    private final ResolutionService resolutionService;

    public MarketController(MarketService marketService, ResolutionService resolutionService) {
        this.marketService = marketService;
        this.resolutionService = resolutionService;
    }

    @PostMapping
    public ResponseEntity<MarketView> create(@Valid @RequestBody CreateMarketRequest request) {
        Market market = marketService.createMarket(request.title(), request.categoryId(), request.creatorId(),
                request.endDate(), request.seedLiquidity());
        return ResponseEntity.status(HttpStatus.CREATED).body(marketService.toView(market));
    }

    @GetMapping("/{marketId}")
    public MarketView get(@PathVariable String marketId) {
        return marketService.view(marketId);
    }

    @GetMapping("/{marketId}/bets")
    public List<Bet> bets(@PathVariable String marketId) {
        return marketService.betsForMarket(marketId);
    }

    @GetMapping("/{marketId}/quote")
    public BetQuote quote(@PathVariable String marketId, @RequestParam String side,
            @RequestParam BigDecimal amount) {
        return marketService.quote(marketId, parseSide(side), amount);
    }

    @PatchMapping("/{marketId}/resolve")
    public MarketView resolve(@PathVariable String marketId, @Valid @RequestBody ResolveMarketRequest request) {
        return marketService.toView(resolutionService.resolve(marketId, request.outcome(), request.note()));
    }

    @PatchMapping("/{marketId}/fees")
    public MarketView updateFees(@PathVariable String marketId, @RequestBody FeeOverrideRequest request) {
        return marketService.toView(
                marketService.updateFeeRates(marketId, request.platformFeeRate(), request.creatorFeeRate()));
    }

    private static Side parseSide(String side) {
        try {
            return Side.fromString(side);
        } catch (IllegalArgumentException e) {
            throw new InvalidBetException(e.getMessage());
        }
    }
}
