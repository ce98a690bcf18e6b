package com.prediction.market.settlement_engine.web;

import java.security.Principal;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.settlement_engine.service.AccountService;
import com.prediction.market.settlement_engine.wallet.CreditResult;
import com.prediction.market.settlement_engine.web.dto.BalanceResponse;
import com.prediction.market.settlement_engine.web.dto.DepositRequest;

import jakarta.validation.Valid;

@RestController
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping("/accounts/me/balance")
    public BalanceResponse balance(Principal principal) {
        String userId = principal.getName();
        return new BalanceResponse(userId, accountService.balance(userId).toBigDecimal());
    }

    @PostMapping("/admin/accounts/{userId}/deposits")
    public Map<String, Object> deposit(@PathVariable String userId, @Valid @RequestBody DepositRequest request) {
        CreditResult result = accountService.deposit(userId, request.amount(), request.reference());
        return Map.of("userId", userId, "result", result, "balance", accountService.balance(userId).toBigDecimal());
    }
}
