package com.prediction.market.settlement_engine.web;

import java.security.Principal;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.settlement_engine.service.ClaimService;
import com.prediction.market.settlement_engine.service.PayoutResult;
import com.prediction.market.settlement_engine.service.UnclaimedWinnings;

@RestController
@RequestMapping("/claims")
public class ClaimController {

    private final ClaimService claimService;

    public ClaimController(ClaimService claimService) {
        this.claimService = claimService;
    }

    @PostMapping("/{betId}")
    public PayoutResult claim(@PathVariable String betId, Principal principal) {
        return claimService.claim(betId, principal.getName());
    }

    @PostMapping("/{betId}/retry")
    public PayoutResult retry(@PathVariable String betId, Principal principal) {
        return claimService.retryTransfer(betId, principal.getName());
    }

    @GetMapping("/unclaimed")
    public UnclaimedWinnings unclaimed(Principal principal) {
        return claimService.unclaimedWinnings(principal.getName());
    }
}
