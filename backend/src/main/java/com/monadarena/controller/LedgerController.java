package com.monadarena.controller;

import com.monadarena.dto.LedgerRequests;
import com.monadarena.dto.LedgerResponses;
import com.monadarena.service.LedgerService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private final LedgerService ledgerService;

    public LedgerController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PostMapping("/accounts/{wallet}/deposits")
    public ResponseEntity<LedgerResponses.AccountBalance> deposit(
            @PathVariable String wallet,
            @Valid @RequestBody LedgerRequests.DepositRequest request
    ) {
        return ResponseEntity.ok(ledgerService.creditExternalDeposit(wallet, request));
    }

    @GetMapping("/accounts/{wallet}")
    public ResponseEntity<LedgerResponses.AccountBalance> getAccount(@PathVariable String wallet) {
        return ResponseEntity.ok(ledgerService.getAccount(wallet));
    }

    @PutMapping("/accounts/{wallet}/payout-block")
    public ResponseEntity<LedgerResponses.AccountBalance> setPayoutBlock(
            @PathVariable String wallet,
            @Valid @RequestBody LedgerRequests.PayoutBlockRequest request
    ) {
        return ResponseEntity.ok(ledgerService.setPayoutsBlocked(wallet, request));
    }

    @GetMapping("/escrow")
    public ResponseEntity<LedgerResponses.EscrowSummary> getEscrowSummary() {
        return ResponseEntity.ok(ledgerService.getEscrowSummary());
    }
}
